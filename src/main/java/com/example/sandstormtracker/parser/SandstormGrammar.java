package com.example.sandstormtracker.parser;

import com.example.sandstormtracker.model.event.ChatMessageEvent;
import com.example.sandstormtracker.model.event.DamageEvent;
import com.example.sandstormtracker.model.event.GameOverEvent;
import com.example.sandstormtracker.model.event.KillEvent;
import com.example.sandstormtracker.model.event.MapChangeEvent;
import com.example.sandstormtracker.model.event.ObjectiveEvent;
import com.example.sandstormtracker.model.event.Participant;
import com.example.sandstormtracker.model.event.PlayerConnectEvent;
import com.example.sandstormtracker.model.event.PlayerDisconnectEvent;
import com.example.sandstormtracker.model.event.RoundEndEvent;
import com.example.sandstormtracker.model.event.RoundStartEvent;

import java.util.List;

/**
 * Line shapes of the Insurgency: Sandstorm server log, in match order.
 * Objective lines are tried before kill lines because both come from LogGameplayEvents.
 */
public final class SandstormGrammar {

    public static final RegexLineMatcher MAP_CHANGE = new RegexLineMatcher("map-change",
        "LogLoad: LoadMap: /Game/Maps/([^/]+)/[^?]+\\?.*Scenario=([^?&]+).*MaxPlayers=(\\d+).*Lighting=([^?&\\s]+)",
        (line, ts, m) -> new MapChangeEvent(line, ts, m.group(1).trim(), m.group(2).trim(),
            Integer.parseInt(m.group(3)), m.group(4).trim()));

    public static final RegexLineMatcher OBJECTIVE_DESTROYED = new RegexLineMatcher("objective-destroyed",
        "LogGameplayEvents: Display: Objective (\\d+) owned by team (\\d+) was destroyed for team (\\d+) by (.+)\\.$",
        (line, ts, m) -> new ObjectiveEvent(line, ts, ObjectiveEvent.Action.DESTROYED,
            Integer.parseInt(m.group(1)), Integer.parseInt(m.group(3)), Integer.parseInt(m.group(2)),
            ParticipantParser.parseListed(m.group(4))));

    public static final RegexLineMatcher OBJECTIVE_CAPTURED = new RegexLineMatcher("objective-captured",
        "LogGameplayEvents: Display: Objective (\\d+) was captured for team (\\d+) from team (\\d+) by (.+)\\.$",
        (line, ts, m) -> new ObjectiveEvent(line, ts, ObjectiveEvent.Action.CAPTURED,
            Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3)),
            ParticipantParser.parseListed(m.group(4))));

    public static final RegexLineMatcher KILL = new RegexLineMatcher("kill",
        "LogGameplayEvents: Display: (.+?) killed ([^\\[]+)\\[([^,\\]]*), team (\\d+)\\] with (.+?)( \\(headshot\\))?$",
        (line, ts, m) -> {
            List<Participant> killers = ParticipantParser.parseKillers(m.group(1));
            Participant victim = new Participant(m.group(2).trim(), m.group(3).trim(), Integer.parseInt(m.group(4)));
            return new KillEvent(line, ts, killers, victim, WeaponNames.clean(m.group(5)), m.group(6) != null);
        });

    public static final RegexLineMatcher LOGIN_REQUEST = new RegexLineMatcher("login-request",
        "LogNet: Login request: .*\\?Name=(.+?) userId: (?:[^:\\s]+:)?(\\S+)",
        (line, ts, m) -> new PlayerConnectEvent(line, ts, PlayerConnectEvent.Stage.LOGIN,
            m.group(1).trim(), m.group(2).trim()));

    public static final RegexLineMatcher JOIN_SUCCEEDED = new RegexLineMatcher("join-succeeded",
        "LogNet: Join succeeded: (.+)$",
        (line, ts, m) -> new PlayerConnectEvent(line, ts, PlayerConnectEvent.Stage.JOINED,
            m.group(1).trim(), null));

    public static final RegexLineMatcher CLIENT_REGISTERED = new RegexLineMatcher("client-registered",
        "LogEOSAntiCheat: Display: ServerRegisterClient: Client: \\((\\d+)\\) Result: \\(EOS_Success\\)",
        (line, ts, m) -> new PlayerConnectEvent(line, ts, PlayerConnectEvent.Stage.REGISTERED,
            null, m.group(1)));

    public static final RegexLineMatcher CLIENT_UNREGISTERED = new RegexLineMatcher("client-unregistered",
        "LogEOSAntiCheat: Display: ServerUnregisterClient: UserId \\((\\d+)\\), Result: \\(EOS_Success\\)",
        (line, ts, m) -> new PlayerDisconnectEvent(line, ts, m.group(1), null));

    public static final RegexLineMatcher RCON_FAREWELL = new RegexLineMatcher("rcon-farewell",
        "LogRcon: .*<< say See you later, (.+)!$",
        (line, ts, m) -> new PlayerDisconnectEvent(line, ts, null, m.group(1).trim()));

    public static final RegexLineMatcher ROUND_START = new RegexLineMatcher("round-start",
        "LogGameplayEvents: Display: (Pre-)?[Rr]ound (\\d+) started",
        (line, ts, m) -> new RoundStartEvent(line, ts, Integer.parseInt(m.group(2)), m.group(1) != null));

    public static final RegexLineMatcher ROUND_END = new RegexLineMatcher("round-end",
        "Log(?:GameMode|GameplayEvents): Display: Round (?:(\\d+) )?O\\s*ver: Team (\\d+) won \\(win reason: (.+)\\)",
        (line, ts, m) -> new RoundEndEvent(line, ts,
            m.group(1) != null ? Integer.valueOf(m.group(1)) : null,
            Integer.parseInt(m.group(2)), m.group(3).trim()));

    public static final RegexLineMatcher GAME_OVER = new RegexLineMatcher("game-over",
        "(?:LogGameplayEvents: Display: Game over|LogSession: Display: AINSGameSession::HandleMatchHasEnded)",
        (line, ts, m) -> new GameOverEvent(line, ts));

    public static final RegexLineMatcher CHAT = new RegexLineMatcher("chat",
        "LogChat: Display: ([^(]+)\\((\\d+)\\) (\\w+) Chat: (.*)$",
        (line, ts, m) -> new ChatMessageEvent(line, ts, m.group(1).trim(), m.group(2), m.group(3), m.group(4).trim()));

    public static final RegexLineMatcher DAMAGE = new RegexLineMatcher("damage",
        "LogSoldier: Applying ([0-9]+(?:\\.[0-9]+)?) (\\w+) damage",
        (line, ts, m) -> new DamageEvent(line, ts, Double.parseDouble(m.group(1)), m.group(2)));

    private SandstormGrammar() {
    }

    public static List<LineMatcher> matchers() {
        return List.of(
            MAP_CHANGE,
            OBJECTIVE_DESTROYED,
            OBJECTIVE_CAPTURED,
            KILL,
            LOGIN_REQUEST,
            JOIN_SUCCEEDED,
            CLIENT_REGISTERED,
            CLIENT_UNREGISTERED,
            RCON_FAREWELL,
            ROUND_START,
            ROUND_END,
            GAME_OVER,
            CHAT,
            DAMAGE
        );
    }
}
