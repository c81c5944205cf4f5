package com.jpmahjong.engine;

import com.jpmahjong.config.KanDoraTiming;
import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.ActionType;
import com.jpmahjong.model.ApplyResult;
import com.jpmahjong.model.GamePhase;
import com.jpmahjong.model.GameState;
import com.jpmahjong.model.HandEndType;
import com.jpmahjong.model.HandOutcome;
import com.jpmahjong.model.KanType;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.MeldType;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.WinDetails;
import com.jpmahjong.model.Yaku;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.HashSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 状态机：吃、碰、明杠、暗杠、加杠与抢杠，以及杠宝牌翻开时机
 */
class GameEngineCallTest {

    private static GameEngine startWith(KanDoraTiming timing, WallPreset preset) {
        RuleProperties rules = new RuleProperties();
        rules.setKanDoraTiming(timing);
        GameEngine engine = new GameEngine(rules);
        engine.setPresetWall(preset.build());
        engine.resetGame(1L);
        return engine;
    }

    private static void passAll(GameEngine engine) {
        GameState state = engine.getGameState();
        while (state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
            int seat = state.getResponseWindow().getPendingSeats().get(0);
            assertTrue(engine.apply(seat, Action.pass()).isAccepted());
        }
    }

    private static void discardDrawn(GameEngine engine) {
        Player player = engine.getGameState().getCurrentPlayer();
        ApplyResult result = engine.apply(player.getSeat(), Action.discard(player.getDrawnTile()));
        assertTrue(result.isAccepted(), "摸切应该总是合法：" + result);
        passAll(engine);
    }

    // 庄家打 3m：1 号位可以吃（24m / 45m），2 号位可以碰
    private static WallPreset chiPonTable() {
        return new WallPreset(0)
            .hand(0, "147m258p369s1234z")
            .hand(1, "245m369p147s1234z")
            .hand(2, "3369m147p258s567z")
            .hand(3, "111p444p777s8s567z")
            .dealerDraw("3m")
            .deadWall("1z1z2z2z3z");
    }

    // 庄家打 5z：2 号位手里有三张，可以碰或明杠；岭上牌 7z，杠宝牌指示牌 3z
    private static WallPreset openKanTable() {
        return new WallPreset(0)
            .hand(0, "147m258p369s1234z")
            .hand(1, "258m369p147s1234z")
            .hand(2, "369m147p258s5556z")
            .hand(3, "9m111p444p777s8s67z")
            .dealerDraw("5z")
            .deadWall("7z7z7z2s1z2s3z2s");
    }

    // 庄家摸到第四张 1m 暗杠，岭上摸到 5z 单骑自摸
    private static WallPreset closedKanTable() {
        return new WallPreset(0)
            .hand(0, "111m234p567p789s5z")
            .dealerDraw("1m")
            .deadWall("5z2s2s2s5z3s6z");
    }

    // 1 号位碰 3s 后摸到第四张加杠；2 号位 12s 边张听 3s，只有抢杠才有役
    private static WallPreset addedKanTable() {
        return new WallPreset(0)
            .hand(0, "1479m258p69s1234z")
            .hand(1, "258m369p133s1234z")
            .hand(2, "123456m55789p12s")
            .hand(3, "111p444p777s8s567z")
            .dealerDraw("3s")
            .draws("5z6z7z3s")
            .deadWall("8s8s8s9s1z");
    }

    @Test
    void testPonBeatsChiAndSkipsTurn() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_REPLACEMENT, chiPonTable());
        GameState state = engine.getGameState();

        assertTrue(engine.apply(0, Action.discard(Tile.of("3m"))).isAccepted());
        assertEquals(GamePhase.WAITING_FOR_RESPONSE, state.getPhase());
        assertEquals(Arrays.asList(1, 2), state.getResponseWindow().getPendingSeats());
        assertTrue(engine.legalActions(1).contains(Action.chi(Tile.of("3m"), Tile.of("2m"), Tile.of("4m"))));
        assertTrue(engine.legalActions(1).contains(Action.chi(Tile.of("3m"), Tile.of("4m"), Tile.of("5m"))));
        assertTrue(engine.legalActions(2).contains(Action.pon(Tile.of("3m"))));

        // 先声明的吃不影响结果
        assertTrue(engine.apply(1, Action.chi(Tile.of("3m"), Tile.of("2m"), Tile.of("4m"))).isAccepted());
        assertTrue(engine.apply(2, Action.pon(Tile.of("3m"))).isAccepted());

        Player caller = state.getPlayer(2);
        assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
        assertEquals(2, state.getCurrentSeat(), "碰牌者接着打牌");
        assertNull(caller.getDrawnTile(), "碰牌后不摸牌");
        assertEquals(1, caller.getMelds().size());
        Meld pon = caller.getMelds().get(0);
        assertEquals(MeldType.PON, pon.getType());
        assertEquals(0, pon.getFromSeat());
        assertEquals(Tile.of("3m"), pon.getCalledTile());
        assertEquals(11, caller.getHandTiles().size());
        assertTrue(state.getPlayer(0).getDiscards().isEmpty(), "被碰的牌从牌河取走");
        assertTrue(state.getPlayer(1).getMelds().isEmpty(), "吃没有成立");
        assertFalse(state.isFirstGoAround(), "鸣牌后第一巡结束");
        for (Action action : engine.legalActions(2)) {
            assertEquals(ActionType.DISCARD, action.getType(), "碰牌后只能打牌");
        }

        assertTrue(engine.apply(2, Action.discard(Tile.of("5z"))).isAccepted());
        passAll(engine);
        assertEquals(3, state.getCurrentSeat(), "碰牌者的下家摸牌，1 号位被跳过");
        assertNotNull(state.getPlayer(3).getDrawnTile());
        assertEquals(136, state.countAllTiles());
    }

    @Test
    void testChiWhenOthersPass() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_REPLACEMENT, chiPonTable());
        GameState state = engine.getGameState();

        assertTrue(engine.apply(0, Action.discard(Tile.of("3m"))).isAccepted());
        assertTrue(engine.apply(1, Action.chi(Tile.of("3m"), Tile.of("4m"), Tile.of("5m"))).isAccepted());
        assertTrue(engine.apply(2, Action.pass()).isAccepted());

        Player caller = state.getPlayer(1);
        assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
        assertEquals(1, state.getCurrentSeat());
        Meld chi = caller.getMelds().get(0);
        assertEquals(MeldType.CHI, chi.getType());
        assertEquals(new HashSet<>(TileFactory.parse("345m")), new HashSet<>(chi.getTiles()));
        assertEquals(TileFactory.parse("2m369p147s1234z"), caller.getHandTiles());
        assertEquals(11, engine.legalActions(1).size(), "每种手牌各一个打牌选择");
        assertTrue(state.getPlayer(0).getDiscards().isEmpty());

        assertTrue(engine.apply(1, Action.discard(Tile.of("1z"))).isAccepted());
        passAll(engine);
        assertEquals(2, state.getCurrentSeat());
        assertNotNull(state.getPlayer(2).getDrawnTile());
    }

    @Test
    void testOpenKanDrawsReplacementTile() {
        for (KanDoraTiming timing : Arrays.asList(KanDoraTiming.BEFORE_REPLACEMENT, KanDoraTiming.AFTER_REPLACEMENT)) {
            GameEngine engine = startWith(timing, openKanTable());
            GameState state = engine.getGameState();

            assertTrue(engine.apply(0, Action.discard(Tile.of("5z"))).isAccepted());
            assertTrue(engine.legalActions(2).contains(Action.pon(Tile.of("5z"))));
            assertTrue(engine.apply(2, Action.kan(KanType.OPEN, Tile.of("5z"))).isAccepted());

            Player caller = state.getPlayer(2);
            assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
            assertEquals(2, state.getCurrentSeat());
            assertEquals(Tile.of("7z"), caller.getDrawnTile(), "明杠后摸岭上牌");
            assertTrue(state.isRinshanDraw());
            assertEquals(1, state.getKanCount());
            assertEquals(3, state.getWall().getReplacementsRemaining());
            Meld kan = caller.getMelds().get(0);
            assertEquals(MeldType.KAN_OPEN, kan.getType());
            assertEquals(4, kan.getTiles().size());
            assertEquals(0, kan.getFromSeat());
            assertTrue(state.getPlayer(0).getDiscards().isEmpty());
            assertEquals(TileFactory.parse("1z3z"), state.getWall().getDoraIndicators(),
                timing + "：杠宝牌在打牌前已翻开");

            discardDrawn(engine);
            assertEquals(3, state.getCurrentSeat());
            assertFalse(state.isRinshanDraw());
            assertEquals(2, state.getWall().getDoraIndicators().size());
            assertEquals(136, state.countAllTiles());
        }
    }

    @Test
    void testOpenKanDoraAfterDiscard() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_DISCARD, openKanTable());
        GameState state = engine.getGameState();

        assertTrue(engine.apply(0, Action.discard(Tile.of("5z"))).isAccepted());
        assertTrue(engine.apply(2, Action.kan(KanType.OPEN, Tile.of("5z"))).isAccepted());

        assertEquals(Tile.of("7z"), state.getPlayer(2).getDrawnTile());
        assertEquals(TileFactory.parse("1z"), state.getWall().getDoraIndicators(), "杠者打牌前不翻杠宝牌");
        assertEquals(1, state.getPendingKanDora());

        assertTrue(engine.apply(2, Action.discard(Tile.of("7z"))).isAccepted());
        assertEquals(TileFactory.parse("1z3z"), state.getWall().getDoraIndicators(), "打牌后翻开");
        assertEquals(0, state.getPendingKanDora());
        assertEquals(TileFactory.parse("2s2s"), state.getWall().getUraIndicators());
    }

    @Test
    void testClosedKanRinshanTsumo() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_REPLACEMENT, closedKanTable());
        GameState state = engine.getGameState();
        Player dealer = state.getDealer();

        Action kan = Action.kan(KanType.CLOSED, Tile.of("1m"));
        assertTrue(engine.legalActions(0).contains(kan));
        assertFalse(engine.legalActions(0).stream().anyMatch(a -> a.getType() == ActionType.RIICHI),
            "能杠时不提供立直");
        assertTrue(engine.apply(0, kan).isAccepted());

        assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
        assertEquals(Tile.of("5z"), dealer.getDrawnTile(), "岭上牌");
        assertEquals(MeldType.KAN_CLOSED, dealer.getMelds().get(0).getType());
        assertTrue(dealer.isMenzen(), "暗杠仍是门前清");
        assertEquals(TileFactory.parse("5z6z"), state.getWall().getDoraIndicators());
        assertFalse(state.isFirstGoAround());
        assertTrue(engine.legalActions(0).contains(Action.tsumo(Tile.of("5z"))));

        ApplyResult result = engine.apply(0, Action.tsumo(Tile.of("5z")));
        assertTrue(result.isAccepted());
        HandOutcome outcome = result.getHandOutcome();
        assertEquals(HandEndType.TSUMO, outcome.getEndType());
        WinDetails details = outcome.getWinDetails();
        assertEquals(new HashSet<>(Arrays.asList(Yaku.MENZEN_TSUMO, Yaku.RINSHAN_KAIHOU)),
            details.getYaku().keySet());
        assertEquals(2, details.getHan());
        assertEquals(60, details.getFu(), "20 + 自摸 2 + 幺九暗杠 32 + 役牌雀头 2 + 单骑 2，进位 60");
        for (int seat = 1; seat <= 3; seat++) {
            assertEquals(-2000, outcome.getScoreChange(seat), "庄家 60 符 2 番自摸 2000 all");
        }
        assertEquals(31000, dealer.getScore());
    }

    @Test
    void testClosedKanRevealsImmediatelyEvenAfterDiscardTiming() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_DISCARD, closedKanTable());
        GameState state = engine.getGameState();

        assertTrue(engine.apply(0, Action.kan(KanType.CLOSED, Tile.of("1m"))).isAccepted());
        assertEquals(TileFactory.parse("5z6z"), state.getWall().getDoraIndicators(), "暗杠总是立即翻开杠宝牌");
        assertEquals(0, state.getPendingKanDora());
    }

    /** 打到 1 号位摸到第四张 3s 为止 */
    private static GameEngine playToAddedKan() {
        GameEngine engine = startWith(KanDoraTiming.AFTER_REPLACEMENT, addedKanTable());
        GameState state = engine.getGameState();

        assertTrue(engine.apply(0, Action.discard(Tile.of("3s"))).isAccepted());
        assertEquals(Arrays.asList(1), state.getResponseWindow().getPendingSeats(), "2 号位无役不能荣和");
        assertTrue(engine.apply(1, Action.pon(Tile.of("3s"))).isAccepted());
        assertTrue(engine.apply(1, Action.discard(Tile.of("1z"))).isAccepted());
        passAll(engine);

        for (int seat : new int[]{2, 3, 0}) {
            assertEquals(seat, state.getCurrentSeat());
            discardDrawn(engine);
        }
        assertEquals(1, state.getCurrentSeat());
        assertEquals(Tile.of("3s"), state.getPlayer(1).getDrawnTile());
        return engine;
    }

    @Test
    void testChankanRon() {
        GameEngine engine = playToAddedKan();
        GameState state = engine.getGameState();

        Action addedKan = Action.kan(KanType.ADDED, Tile.of("3s"));
        assertTrue(engine.legalActions(1).contains(addedKan));
        assertTrue(engine.apply(1, addedKan).isAccepted());

        assertEquals(GamePhase.WAITING_FOR_RESPONSE, state.getPhase());
        assertTrue(state.getResponseWindow().isChankan());
        assertEquals(Arrays.asList(2), state.getResponseWindow().getPendingSeats());
        assertEquals(Arrays.asList(Action.ron(Tile.of("3s")), Action.pass()), engine.legalActions(2),
            "抢杠时只能荣和或过");

        ApplyResult result = engine.apply(2, Action.ron(Tile.of("3s")));
        assertTrue(result.isAccepted());
        HandOutcome outcome = result.getHandOutcome();
        assertEquals(HandEndType.RON, outcome.getEndType());
        assertEquals(2, outcome.getWinner());
        assertEquals(1, outcome.getLoser());
        assertTrue(outcome.getWinDetails().getYaku().containsKey(Yaku.CHANKAN));
        assertEquals(1, outcome.getWinDetails().getHan());
        assertEquals(40, outcome.getWinDetails().getFu(), "20 + 门清荣和 10 + 边张 2，进位 40");
        assertEquals(1300, outcome.getScoreChange(2));
        assertEquals(-1300, outcome.getScoreChange(1));
        assertEquals(MeldType.PON, state.getPlayer(1).getMelds().get(0).getType(), "被抢的杠不成立");
        assertEquals(1, state.getWall().getDoraIndicators().size());
    }

    @Test
    void testAddedKanCompletesWhenChankanPassed() {
        GameEngine engine = playToAddedKan();
        GameState state = engine.getGameState();

        assertTrue(engine.apply(1, Action.kan(KanType.ADDED, Tile.of("3s"))).isAccepted());
        assertTrue(engine.apply(2, Action.pass()).isAccepted());

        Player kanPlayer = state.getPlayer(1);
        assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
        assertEquals(1, state.getCurrentSeat());
        assertEquals(MeldType.KAN_ADDED, kanPlayer.getMelds().get(0).getType());
        assertEquals(4, kanPlayer.getMelds().get(0).getTiles().size());
        assertEquals(Tile.of("8s"), kanPlayer.getDrawnTile(), "加杠后摸岭上牌");
        assertTrue(state.isRinshanDraw());
        assertEquals(2, state.getWall().getDoraIndicators().size());
        assertTrue(state.getPlayer(2).isTemporaryFuriten(), "放过抢杠进入同巡振听");
        assertEquals(136, state.countAllTiles());
    }
}
