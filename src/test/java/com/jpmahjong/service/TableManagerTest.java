package com.jpmahjong.service;

import com.jpmahjong.config.GameLength;
import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.engine.GameEngine;
import com.jpmahjong.engine.WallPreset;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.ApplyResult;
import com.jpmahjong.model.GamePhase;
import com.jpmahjong.model.GameState;
import com.jpmahjong.model.HandEndType;
import com.jpmahjong.model.NextHandParameters;
import com.jpmahjong.model.Player;
import com.jpmahjong.model.Tile;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 牌桌管理
 */
class TableManagerTest {

    @Test
    void testCreateAndCloseTable() {
        TableManager manager = new TableManager(new RuleProperties());
        String tableId = manager.createTable(11L);

        assertTrue(tableId.startsWith("TABLE_"));
        GameEngine engine = manager.getEngine(tableId);
        assertNotNull(engine);
        assertEquals(GamePhase.PLAYER_DISCARD, engine.getGameState().getPhase(), "创建后第一局已经开始");
        assertFalse(manager.legalActions(tableId, 0).isEmpty());
        assertEquals(1, manager.getAllTables().size());

        manager.closeTable(tableId);
        assertNull(manager.getEngine(tableId));
        assertTrue(manager.legalActions(tableId, 0).isEmpty());
    }

    @Test
    void testUnknownTableRejected() {
        TableManager manager = new TableManager(new RuleProperties());
        ApplyResult result = manager.apply("TABLE_missing", 0, Action.pass());
        assertFalse(result.isAccepted());
        assertNotNull(result.getReason());
    }

    @Test
    void testAutoNextHand() {
        TableManager manager = new TableManager(new RuleProperties());
        String tableId = manager.createTable(5L);
        GameState state = manager.getEngine(tableId).getGameState();

        // 全员摸切、从不响应，最后一定荒牌流局
        ApplyResult last = null;
        int guard = 0;
        while (state.getHandCount() == 1) {
            if (state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
                int seat = state.getResponseWindow().getPendingSeats().get(0);
                last = manager.apply(tableId, seat, Action.pass());
            } else {
                Player current = state.getCurrentPlayer();
                last = manager.apply(tableId, current.getSeat(), Action.discard(current.getDrawnTile()));
            }
            assertTrue(last.isAccepted());
            assertTrue(++guard < 1000, "应该在有限步内流局");
        }

        assertEquals(GamePhase.HAND_OVER_SCORES, last.getPhase());
        assertEquals(HandEndType.EXHAUSTIVE_DRAW, last.getHandOutcome().getEndType());
        assertEquals(2, state.getHandCount(), "自动开始下一局");
        assertEquals(GamePhase.PLAYER_DISCARD, state.getPhase());
        assertEquals(1, state.getHonba());
    }

    @Test
    void testManualNextHand() {
        RuleProperties rules = new RuleProperties();
        rules.setAutoNextHand(false);
        TableManager manager = new TableManager(rules);
        String tableId = manager.createTable(5L);
        GameEngine engine = manager.getEngine(tableId);
        GameState state = engine.getGameState();

        int guard = 0;
        while (state.getPhase() == GamePhase.PLAYER_DISCARD || state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
            if (state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
                manager.apply(tableId, state.getResponseWindow().getPendingSeats().get(0), Action.pass());
            } else {
                Player current = state.getCurrentPlayer();
                manager.apply(tableId, current.getSeat(), Action.discard(current.getDrawnTile()));
            }
            assertTrue(++guard < 1000);
        }

        assertEquals(GamePhase.HAND_OVER_SCORES, state.getPhase(), "不自动续局时停在结算阶段");
        assertNotNull(engine.getHandOutcome());
        assertTrue(manager.legalActions(tableId, 0).isEmpty());
        engine.resetNewHand();
        assertEquals(2, state.getHandCount());
    }

    @Test
    void testFinishedTableKeptUntilClosed() {
        RuleProperties rules = new RuleProperties();
        rules.setGameLength(GameLength.TONPUUSEN);
        TableManager manager = new TableManager(rules);
        String tableId = manager.createTable(3L);
        GameEngine engine = manager.getEngine(tableId);
        GameState state = engine.getGameState();

        // 直接进入东四局（庄家座位 3）
        state.setNextHandParameters(new NextHandParameters(3, 0, 4, 0, 0));
        engine.setPresetWall(new WallPreset(3)
            .hand(0, "234m567m234p567p8s")
            .dealerDraw("8s")
            .deadWall("6s6s6s6s1z1z")
            .build());
        engine.resetNewHand();

        assertTrue(manager.apply(tableId, 3, Action.discard(Tile.of("8s"))).isAccepted());
        ApplyResult last = null;
        while (state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
            int seat = state.getResponseWindow().getPendingSeats().get(0);
            last = manager.apply(tableId, seat, seat == 0 ? Action.ron(Tile.of("8s")) : Action.pass());
        }

        assertNotNull(last);
        assertEquals(GamePhase.GAME_OVER, last.getPhase());
        assertSame(engine, manager.getEngine(tableId), "终局后牌桌保留，可以读取最终点数");
        assertEquals(26300, engine.getGameState().getPlayer(0).getScore());
        assertTrue(manager.legalActions(tableId, 0).isEmpty());
        assertFalse(manager.apply(tableId, 0, Action.pass()).isAccepted(), "终局后不再接受行动");

        manager.closeTable(tableId);
        assertNull(manager.getEngine(tableId));
    }

    @Test
    void testLegalActionsReadWhileApplying() throws Exception {
        TableManager manager = new TableManager(new RuleProperties());
        String tableId = manager.createTable(8L);
        GameState state = manager.getEngine(tableId).getGameState();
        AtomicBoolean running = new AtomicBoolean(true);

        ExecutorService reader = Executors.newSingleThreadExecutor();
        try {
            Future<Integer> reads = reader.submit(() -> {
                int count = 0;
                while (running.get()) {
                    for (int seat = 0; seat < GameState.PLAYER_COUNT; seat++) {
                        List<Action> actions = manager.legalActions(tableId, seat);
                        for (Action action : actions) {
                            assertNotNull(action.getType());
                        }
                    }
                    count++;
                }
                return count;
            });

            int guard = 0;
            while (state.getHandCount() == 1) {
                if (state.getPhase() == GamePhase.WAITING_FOR_RESPONSE) {
                    manager.apply(tableId, state.getResponseWindow().getPendingSeats().get(0), Action.pass());
                } else {
                    Player current = state.getCurrentPlayer();
                    manager.apply(tableId, current.getSeat(), Action.discard(current.getDrawnTile()));
                }
                assertTrue(++guard < 1000);
            }
            running.set(false);
            assertTrue(reads.get(10, TimeUnit.SECONDS) > 0, "读取线程全程没有异常");
        } finally {
            reader.shutdownNow();
        }
    }
}
