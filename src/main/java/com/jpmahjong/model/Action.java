package com.jpmahjong.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * 玩家行动（不可变）
 * <p>
 * 各类型携带的牌：
 * <ul>
 *   <li>DISCARD / RIICHI：要打出的牌</li>
 *   <li>CHI：被吃的牌 + 手中用来吃的两张牌</li>
 *   <li>PON：被碰的牌</li>
 *   <li>KAN：暗杠为该种牌，加杠为加上去的那张牌，大明杠为被杠的牌</li>
 *   <li>TSUMO / RON：和了牌</li>
 *   <li>PASS / SPECIAL_DRAW：无</li>
 * </ul>
 */
public final class Action {
    private final ActionType type;
    private final Tile tile;
    private final List<Tile> chiTiles;
    private final KanType kanType;

    private Action(ActionType type, Tile tile, List<Tile> chiTiles, KanType kanType) {
        this.type = type;
        this.tile = tile;
        this.chiTiles = chiTiles;
        this.kanType = kanType;
    }

    public static Action discard(Tile tile) {
        return new Action(ActionType.DISCARD, Objects.requireNonNull(tile), Collections.emptyList(), null);
    }

    public static Action riichi(Tile tile) {
        return new Action(ActionType.RIICHI, Objects.requireNonNull(tile), Collections.emptyList(), null);
    }

    public static Action chi(Tile calledTile, Tile handTileA, Tile handTileB) {
        List<Tile> used = new ArrayList<>();
        used.add(Objects.requireNonNull(handTileA));
        used.add(Objects.requireNonNull(handTileB));
        Collections.sort(used);
        return new Action(ActionType.CHI, Objects.requireNonNull(calledTile), Collections.unmodifiableList(used), null);
    }

    public static Action pon(Tile calledTile) {
        return new Action(ActionType.PON, Objects.requireNonNull(calledTile), Collections.emptyList(), null);
    }

    public static Action kan(KanType kanType, Tile tile) {
        return new Action(ActionType.KAN, Objects.requireNonNull(tile), Collections.emptyList(), Objects.requireNonNull(kanType));
    }

    public static Action tsumo(Tile winningTile) {
        return new Action(ActionType.TSUMO, Objects.requireNonNull(winningTile), Collections.emptyList(), null);
    }

    public static Action ron(Tile winningTile) {
        return new Action(ActionType.RON, Objects.requireNonNull(winningTile), Collections.emptyList(), null);
    }

    public static Action pass() {
        return new Action(ActionType.PASS, null, Collections.emptyList(), null);
    }

    public static Action specialDraw() {
        return new Action(ActionType.SPECIAL_DRAW, null, Collections.emptyList(), null);
    }

    public ActionType getType() {
        return type;
    }

    public Tile getTile() {
        return tile;
    }

    /**
     * 吃牌时手中用掉的两张牌（其他类型为空列表）
     */
    public List<Tile> getChiTiles() {
        return chiTiles;
    }

    public KanType getKanType() {
        return kanType;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Action)) {
            return false;
        }
        Action action = (Action) o;
        return type == action.type
            && Objects.equals(tile, action.tile)
            && chiTiles.equals(action.chiTiles)
            && kanType == action.kanType;
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, tile, chiTiles, kanType);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(type.name());
        if (kanType != null) {
            sb.append('(').append(kanType).append(')');
        }
        if (tile != null) {
            sb.append(' ').append(tile);
        }
        if (!chiTiles.isEmpty()) {
            sb.append(' ').append(chiTiles);
        }
        return sb.toString();
    }
}
