package com.jpmahjong.engine;

import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.ActionType;
import com.jpmahjong.model.GameState;
import com.jpmahjong.model.KanType;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.Tile;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 合法行动与响应优先级
 */
class ActionValidatorTest {

    private final RuleProperties rules = new RuleProperties();
    private GameState state;

    @BeforeEach
    void setUp() {
        state = new GameState(25000);
        state.getWall().setupFromOrder(TileFactory.createFullSet(0));
        state.setFirstGoAround(false);
    }

    private void giveHand(int seat, String codes) {
        Player player = state.getPlayer(seat);
        for (Tile tile : TileFactory.parse(codes)) {
            player.addTile(tile);
        }
        player.sortHand();
    }

    private static long count(List<Action> actions, ActionType type) {
        return actions.stream().filter(a -> a.getType() == type).count();
    }

    // ==================== 优先级裁决 ====================

    @Test
    void testRonBeatsPon() {
        Tile tile = Tile.of("5m");
        Map<Integer, Action> declarations = new HashMap<>();
        declarations.put(1, Action.pon(tile));
        declarations.put(2, Action.ron(tile));
        declarations.put(3, Action.pass());

        Optional<ActionValidator.Resolution> resolution = ActionValidator.resolve(declarations, 0);
        assertTrue(resolution.isPresent());
        assertEquals(2, resolution.get().getSeat());
        assertEquals(ActionType.RON, resolution.get().getAction().getType());
    }

    @Test
    void testPonBeatsChi() {
        Tile tile = Tile.of("5m");
        Map<Integer, Action> declarations = new HashMap<>();
        declarations.put(1, Action.chi(tile, Tile.of("3m"), Tile.of("4m")));
        declarations.put(2, Action.pon(tile));

        assertEquals(2, ActionValidator.resolve(declarations, 0).get().getSeat());
    }

    @Test
    void testDoubleRonGoesToFirstSeatBeforeDiscarder() {
        Tile tile = Tile.of("5m");
        Map<Integer, Action> declarations = new HashMap<>();
        declarations.put(1, Action.ron(tile));
        declarations.put(3, Action.ron(tile));

        // 打牌者 0 的上家是 3
        assertEquals(3, ActionValidator.resolve(declarations, 0).get().getSeat());
        // 打牌者 2 的上家是 1
        assertEquals(1, ActionValidator.resolve(declarations, 2).get().getSeat());
    }

    @Test
    void testAllPass() {
        Map<Integer, Action> declarations = new HashMap<>();
        declarations.put(1, Action.pass());
        declarations.put(2, Action.pass());
        declarations.put(3, Action.pass());
        assertFalse(ActionValidator.resolve(declarations, 0).isPresent());
    }

    // ==================== 响应 ====================

    @Test
    void testChiOnlyForNextSeat() {
        giveHand(1, "3467m11p22p33s44s5z");
        giveHand(2, "3467m11p22p33s44s5z");

        List<Action> nextSeat = ActionValidator.legalActionsOnResponse(state, 1, Tile.of("5m"), 0, false, rules);
        assertEquals(3, count(nextSeat, ActionType.CHI), "34m、46m、67m 三种吃法");
        assertTrue(nextSeat.contains(Action.chi(Tile.of("5m"), Tile.of("4m"), Tile.of("6m"))));
        assertEquals(1, count(nextSeat, ActionType.PASS));

        List<Action> across = ActionValidator.legalActionsOnResponse(state, 2, Tile.of("5m"), 0, false, rules);
        assertEquals(Collections.singletonList(Action.pass()), across, "对家不能吃");
    }

    @Test
    void testPonAndOpenKan() {
        giveHand(2, "555p123m789m11s22s");

        List<Action> actions = ActionValidator.legalActionsOnResponse(state, 2, Tile.of("5p"), 0, false, rules);
        assertTrue(actions.contains(Action.pon(Tile.of("5p"))));
        assertTrue(actions.contains(Action.kan(KanType.OPEN, Tile.of("5p"))));

        state.getPlayer(2).setRiichi(true);
        actions = ActionValidator.legalActionsOnResponse(state, 2, Tile.of("5p"), 0, false, rules);
        assertEquals(0, count(actions, ActionType.PON), "立直后不能鸣牌");
        assertEquals(0, count(actions, ActionType.KAN));
    }

    @Test
    void testRonAndFuriten() {
        giveHand(1, "123m456m789m123p5p");

        List<Action> actions = ActionValidator.legalActionsOnResponse(state, 1, Tile.of("5p"), 3, false, rules);
        assertTrue(actions.contains(Action.ron(Tile.of("5p"))), "一气通贯单骑 5p 可以荣和");

        state.getPlayer(1).getDiscardedValues().add(Tile.of("5p").getValue());
        actions = ActionValidator.legalActionsOnResponse(state, 1, Tile.of("5p"), 3, false, rules);
        assertEquals(0, count(actions, ActionType.RON), "振听不能荣和");
    }

    @Test
    void testChankanWindowOffersOnlyRon() {
        // 1 号位单骑 1z，手里有三张 5p
        giveHand(1, "123m456m789m555p1z");
        List<Action> actions = ActionValidator.legalActionsOnResponse(state, 1, Tile.of("5p"), 0, true, rules);
        assertEquals(Collections.singletonList(Action.pass()), actions, "抢杠只能荣和，不能碰杠");
    }

    // ==================== 摸牌后 ====================

    @Test
    void testRiichiOptionsAfterDraw() {
        giveHand(0, "123m456m789m123p5p");
        state.getPlayer(0).setDrawnTile(Tile.of("9s"));

        List<Action> actions = ActionValidator.legalActionsOnDraw(state, 0, rules);
        assertTrue(actions.contains(Action.riichi(Tile.of("9s"))));
        assertTrue(actions.contains(Action.riichi(Tile.of("5p"))), "打 5p 听 9s 也可以立直");
        assertFalse(actions.contains(Action.riichi(Tile.of("1m"))));
        assertEquals(0, count(actions, ActionType.TSUMO));
        assertEquals(14, count(actions, ActionType.DISCARD), "每种手牌各一个打牌选项");
    }

    @Test
    void testRiichiPlayerMustDiscardDrawnTile() {
        giveHand(0, "123m456m789m123p5p");
        Player player = state.getPlayer(0);
        player.setRiichi(true);
        player.setDrawnTile(Tile.of("9s"));

        assertEquals(Collections.singletonList(Action.discard(Tile.of("9s"))),
            ActionValidator.legalActionsOnDraw(state, 0, rules));
    }

    @Test
    void testTsumoOffered() {
        giveHand(0, "123m456m789m123p5p");
        state.getPlayer(0).setDrawnTile(Tile.of("5p"));

        List<Action> actions = ActionValidator.legalActionsOnDraw(state, 0, rules);
        assertTrue(actions.contains(Action.tsumo(Tile.of("5p"))));
        assertEquals(0, count(actions, ActionType.RIICHI), "能自摸时不提供立直");
    }

    @Test
    void testClosedKanOffered() {
        giveHand(0, "1111m456m789m12p5p");
        state.getPlayer(0).setDrawnTile(Tile.of("9s"));

        List<Action> actions = ActionValidator.legalActionsOnDraw(state, 0, rules);
        assertTrue(actions.contains(Action.kan(KanType.CLOSED, Tile.of("1m"))));
    }

    @Test
    void testNineTerminalsOnlyOnFirstDraw() {
        giveHand(0, "19m19p19s1234z234m");
        state.getPlayer(0).setDrawnTile(Tile.of("5z"));

        state.setFirstGoAround(true);
        assertTrue(ActionValidator.legalActionsOnDraw(state, 0, rules).contains(Action.specialDraw()));

        state.setFirstGoAround(false);
        assertFalse(ActionValidator.legalActionsOnDraw(state, 0, rules).contains(Action.specialDraw()));
    }
}
