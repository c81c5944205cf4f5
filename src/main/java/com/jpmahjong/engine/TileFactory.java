package com.jpmahjong.engine;

import com.jpmahjong.model.Tile;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * 麻将牌工厂 - 创建、洗牌、解析牌码
 */
public class TileFactory {

    private TileFactory() {
    }

    /**
     * 创建一副完整的日麻牌（136张）
     * 万、筒、索各36张（1-9，每张4张），其中每种的 5 有 redFivesPerSuit 张换成赤五
     * 东南西北、白发中各4张
     */
    public static List<Tile> createFullSet(int redFivesPerSuit) {
        if (redFivesPerSuit < 0 || redFivesPerSuit > 4) {
            throw new IllegalArgumentException("赤五张数必须在 0-4 之间：" + redFivesPerSuit);
        }
        List<Tile> tiles = new ArrayList<>(136);
        for (int value = 0; value < Tile.KINDS; value++) {
            boolean isFive = value < 27 && value % 9 == 4;
            for (int count = 0; count < 4; count++) {
                tiles.add(new Tile(value, isFive && count < redFivesPerSuit));
            }
        }
        return tiles;
    }

    /**
     * 洗牌（种子相同则结果相同）
     */
    public static void shuffle(List<Tile> tiles, Random random) {
        Collections.shuffle(tiles, random);
    }

    /**
     * 解析紧凑牌码，如 "123m456p789s11z"，0 表示赤五
     */
    public static List<Tile> parse(String codes) {
        List<Tile> tiles = new ArrayList<>();
        if (codes == null) {
            return tiles;
        }
        List<Character> digits = new ArrayList<>();
        for (char c : codes.replace(" ", "").toCharArray()) {
            if (Character.isDigit(c)) {
                digits.add(c);
                continue;
            }
            if (digits.isEmpty()) {
                throw new IllegalArgumentException("牌码缺少点数：" + codes);
            }
            for (char digit : digits) {
                tiles.add(Tile.of("" + digit + c));
            }
            digits.clear();
        }
        if (!digits.isEmpty()) {
            throw new IllegalArgumentException("牌码缺少花色：" + codes);
        }
        return tiles;
    }

    /**
     * 转成紧凑牌码（与 parse 相反）
     */
    public static String toCodes(List<Tile> tiles) {
        StringBuilder sb = new StringBuilder();
        List<Tile> sorted = new ArrayList<>(tiles);
        Collections.sort(sorted);
        char currentSuit = 0;
        for (Tile tile : sorted) {
            String code = tile.getCode();
            char suit = code.charAt(1);
            if (currentSuit != 0 && suit != currentSuit) {
                sb.append(currentSuit);
            }
            sb.append(code.charAt(0));
            currentSuit = suit;
        }
        if (currentSuit != 0) {
            sb.append(currentSuit);
        }
        return sb.toString();
    }
}
