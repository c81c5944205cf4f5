package com.jpmahjong.engine;

/**
 * 引擎内部状态不一致（牌数不守恒、合法行动执行失败等），属于程序错误而不是玩家的非法操作
 */
public class EngineInvariantException extends IllegalStateException {

    public EngineInvariantException(String message) {
        super(message);
    }
}
