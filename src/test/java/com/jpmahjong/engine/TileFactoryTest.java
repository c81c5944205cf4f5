package com.jpmahjong.engine;

import com.jpmahjong.model.Suit;
import com.jpmahjong.model.Tile;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 牌工厂测试
 */
class TileFactoryTest {

    @Test
    void testCreateFullSet() {
        List<Tile> tiles = TileFactory.createFullSet(1);

        assertEquals(136, tiles.size(), "牌总数应该是136张");

        long manCount = tiles.stream().filter(t -> t.getSuit() == Suit.MAN).count();
        long pinCount = tiles.stream().filter(t -> t.getSuit() == Suit.PIN).count();
        long souCount = tiles.stream().filter(t -> t.getSuit() == Suit.SOU).count();
        assertEquals(36, manCount, "万子应该有36张");
        assertEquals(36, pinCount, "筒子应该有36张");
        assertEquals(36, souCount, "索子应该有36张");

        long honorCount = tiles.stream().filter(Tile::isHonor).count();
        assertEquals(28, honorCount, "字牌应该有28张");

        for (int value = 0; value < Tile.KINDS; value++) {
            final int v = value;
            assertEquals(4, tiles.stream().filter(t -> t.getValue() == v).count(), "每种牌4张");
        }
    }

    @Test
    void testRedFives() {
        assertEquals(3, TileFactory.createFullSet(1).stream().filter(Tile::isRed).count(), "每种数牌一张赤五");
        assertEquals(0, TileFactory.createFullSet(0).stream().filter(Tile::isRed).count());
        assertEquals(12, TileFactory.createFullSet(4).stream().filter(Tile::isRed).count());
        assertThrows(IllegalArgumentException.class, () -> TileFactory.createFullSet(5));
    }

    @Test
    void testShuffleWithSeed() {
        List<Tile> tiles1 = new ArrayList<>(TileFactory.createFullSet(1));
        List<Tile> tiles2 = new ArrayList<>(TileFactory.createFullSet(1));

        TileFactory.shuffle(tiles1, new Random(42));
        TileFactory.shuffle(tiles2, new Random(42));

        assertEquals(136, tiles1.size());
        assertEquals(tiles1, tiles2, "种子相同洗牌结果应该相同");
        assertNotEquals(TileFactory.createFullSet(1), tiles1, "洗牌后顺序应该改变");
    }

    @Test
    void testParseAndToCodes() {
        List<Tile> tiles = TileFactory.parse("123m406p789s11z");
        assertEquals(11, tiles.size());
        assertTrue(tiles.get(4).isRed(), "0p 解析为赤五筒");
        assertEquals("123m406p789s11z", TileFactory.toCodes(tiles), "赤五写作 0");

        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("123"));
        assertThrows(IllegalArgumentException.class, () -> TileFactory.parse("m123"));
    }
}
