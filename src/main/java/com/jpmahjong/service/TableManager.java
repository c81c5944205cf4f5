package com.jpmahjong.service;

import com.jpmahjong.config.RuleProperties;
import com.jpmahjong.engine.GameEngine;
import com.jpmahjong.model.Action;
import com.jpmahjong.model.ApplyResult;
import com.jpmahjong.model.GamePhase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 牌桌管理器 - 持有多桌对局，每桌一个引擎
 */
@Service
public class TableManager {

    private static final Logger log = LoggerFactory.getLogger(TableManager.class);

    private final RuleProperties rules;
    private final Map<String, GameEngine> tables = new ConcurrentHashMap<>();

    public TableManager(RuleProperties rules) {
        this.rules = rules;
    }

    /**
     * 创建牌桌并开始第一局
     *
     * @param seed 随机种子，null 表示不固定
     */
    public String createTable(Long seed) {
        String tableId = "TABLE_" + UUID.randomUUID().toString().substring(0, 8);
        GameEngine engine = new GameEngine(rules);
        engine.resetGame(seed);
        tables.put(tableId, engine);
        log.info("牌桌创建成功：{}", tableId);
        return tableId;
    }

    /**
     * 获取游戏引擎
     */
    public GameEngine getEngine(String tableId) {
        return tables.get(tableId);
    }

    /**
     * 某座位当前的合法行动（返回快照，之后的行动不会改动它）
     */
    public List<Action> legalActions(String tableId, int seat) {
        GameEngine engine = tables.get(tableId);
        if (engine == null) {
            log.warn("牌桌不存在：{}", tableId);
            return Collections.emptyList();
        }
        synchronized (engine) {
            return new ArrayList<>(engine.legalActions(seat));
        }
    }

    /**
     * 执行行动；单局结束且配置了自动续局时直接开始下一局
     */
    public ApplyResult apply(String tableId, int seat, Action action) {
        GameEngine engine = tables.get(tableId);
        if (engine == null) {
            log.warn("牌桌不存在：{}", tableId);
            return ApplyResult.rejected(null, "牌桌不存在：" + tableId);
        }
        synchronized (engine) {
            ApplyResult result = engine.apply(seat, action);
            if (!result.isAccepted()) {
                return result;
            }
            if (result.getPhase() == GamePhase.GAME_OVER) {
                log.info("牌桌 {} 整场结束", tableId);
            } else if (result.getPhase() == GamePhase.HAND_OVER_SCORES && rules.isAutoNextHand()) {
                engine.resetNewHand();
            }
            return result;
        }
    }

    /**
     * 关闭牌桌
     */
    public void closeTable(String tableId) {
        if (tables.remove(tableId) != null) {
            log.info("牌桌 {} 已关闭", tableId);
        }
    }

    /**
     * 获取所有牌桌
     */
    public Map<String, GameEngine> getAllTables() {
        return tables;
    }
}
