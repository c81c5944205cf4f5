package com.jpmahjong.engine;

import com.jpmahjong.model.HandComponent;
import com.jpmahjong.model.Meld;
import com.jpmahjong.model.Tile;
import com.jpmahjong.model.WinForm;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * 手牌分析器 - 和牌拆解、听牌判断
 * <p>
 * 纯函数：只读入参，不持有状态。失败时返回空结果而不抛异常。
 */
public class HandAnalyzer {

    /** 国士无双需要的 13 种幺九牌 */
    private static final int[] ORPHANS = {0, 8, 9, 17, 18, 26, 27, 28, 29, 30, 31, 32, 33};

    private HandAnalyzer() {
    }

    /**
     * 拆解和牌：返回所有合法的拆法，无法和牌时返回空列表
     * 暗牌张数必须为 14 - 3 × 副露数
     */
    public static List<WinForm> decompose(List<Tile> concealed, List<Meld> melds) {
        List<Meld> fixed = melds == null ? Collections.emptyList() : melds;
        if (concealed == null || fixed.size() > 4 || concealed.size() != 14 - 3 * fixed.size()) {
            return Collections.emptyList();
        }
        int[] counts = toCounts(concealed);

        List<HandComponent> openSets = new ArrayList<>();
        for (Meld meld : fixed) {
            openSets.add(HandComponent.fromMeld(meld));
        }

        List<WinForm> forms = new ArrayList<>();
        int needed = 4 - fixed.size();

        // 标准形：先定雀头，剩余牌全部拆成面子
        for (int pair = 0; pair < Tile.KINDS; pair++) {
            if (counts[pair] < 2) {
                continue;
            }
            counts[pair] -= 2;
            List<List<HandComponent>> results = new ArrayList<>();
            extractSets(counts, needed, new ArrayList<>(), results);
            counts[pair] += 2; // 回溯

            for (List<HandComponent> concealedSets : results) {
                List<HandComponent> sets = new ArrayList<>(openSets);
                sets.addAll(concealedSets);
                forms.add(WinForm.standard(sets, pair));
            }
        }

        // 七对子 / 国士无双：只看门清 14 张
        if (fixed.isEmpty()) {
            List<Integer> pairs = sevenPairs(counts);
            if (pairs != null) {
                forms.add(WinForm.sevenPairs(pairs));
            }
            int orphanPair = thirteenOrphansPair(counts);
            if (orphanPair >= 0) {
                forms.add(WinForm.thirteenOrphans(orphanPair));
            }
        }
        return forms;
    }

    /**
     * 是否为和牌形（只判断有无，不收集拆法）
     */
    public static boolean isWinningShape(List<Tile> concealed, List<Meld> melds) {
        int meldCount = melds == null ? 0 : melds.size();
        if (concealed == null || meldCount > 4 || concealed.size() != 14 - 3 * meldCount) {
            return false;
        }
        int[] counts = toCounts(concealed);
        return isWinningCounts(counts, meldCount);
    }

    /**
     * 是否听牌（13 张或副露后的 13 - 3n 张）
     */
    public static boolean isTenpai(List<Tile> concealed, List<Meld> melds) {
        return !findWaitTiles(concealed, melds).isEmpty();
    }

    /**
     * 计算听的牌：逐一尝试 34 种牌，自己已经持有 4 张的牌不算听牌
     */
    public static SortedSet<Integer> findWaitTiles(List<Tile> concealed, List<Meld> melds) {
        SortedSet<Integer> waits = new TreeSet<>();
        int meldCount = melds == null ? 0 : melds.size();
        if (concealed == null || meldCount > 4 || concealed.size() != 13 - 3 * meldCount) {
            return waits;
        }

        int[] counts = toCounts(concealed);
        int[] held = counts.clone();
        if (melds != null) {
            for (Meld meld : melds) {
                for (Tile tile : meld.getTiles()) {
                    held[tile.getValue()]++;
                }
            }
        }

        for (int candidate = 0; candidate < Tile.KINDS; candidate++) {
            if (held[candidate] >= 4) {
                continue;
            }
            counts[candidate]++;
            if (isWinningCounts(counts, meldCount)) {
                waits.add(candidate);
            }
            counts[candidate]--;
        }
        return waits;
    }

    /**
     * 不同种类的幺九牌数量（九种九牌判断用）
     */
    public static int countDistinctTerminalHonors(List<Tile> tiles) {
        int[] counts = toCounts(tiles);
        int distinct = 0;
        for (int value : ORPHANS) {
            if (counts[value] > 0) {
                distinct++;
            }
        }
        return distinct;
    }

    /**
     * 转为 34 格计数数组
     */
    public static int[] toCounts(List<Tile> tiles) {
        int[] counts = new int[Tile.KINDS];
        for (Tile tile : tiles) {
            counts[tile.getValue()]++;
        }
        return counts;
    }

    // === 内部实现 ===

    private static boolean isWinningCounts(int[] counts, int meldCount) {
        int needed = 4 - meldCount;
        for (int pair = 0; pair < Tile.KINDS; pair++) {
            if (counts[pair] < 2) {
                continue;
            }
            counts[pair] -= 2;
            boolean ok = canExtractSets(counts, needed);
            counts[pair] += 2;
            if (ok) {
                return true;
            }
        }
        if (meldCount == 0) {
            return sevenPairs(counts) != null || thirteenOrphansPair(counts) >= 0;
        }
        return false;
    }

    /**
     * 收集所有拆法：每次取最小的一张，作刻子或顺子开头
     */
    private static void extractSets(int[] counts, int remaining, List<HandComponent> current,
                                    List<List<HandComponent>> results) {
        int first = firstPresent(counts);
        if (first < 0) {
            if (remaining == 0) {
                results.add(new ArrayList<>(current));
            }
            return;
        }
        if (remaining == 0) {
            return;
        }

        // 尝试一：刻子 AAA
        if (counts[first] >= 3) {
            counts[first] -= 3;
            current.add(new HandComponent(HandComponent.Kind.TRIPLET, first, false));
            extractSets(counts, remaining - 1, current, results);
            current.remove(current.size() - 1);
            counts[first] += 3;
        }

        // 尝试二：顺子 ABC（只有数牌，且起始点数 ≤ 7）
        if (canStartRun(counts, first)) {
            counts[first]--;
            counts[first + 1]--;
            counts[first + 2]--;
            current.add(new HandComponent(HandComponent.Kind.RUN, first, false));
            extractSets(counts, remaining - 1, current, results);
            current.remove(current.size() - 1);
            counts[first]++;
            counts[first + 1]++;
            counts[first + 2]++;
        }
    }

    private static boolean canExtractSets(int[] counts, int remaining) {
        int first = firstPresent(counts);
        if (first < 0) {
            return remaining == 0;
        }
        if (remaining == 0) {
            return false;
        }
        if (counts[first] >= 3) {
            counts[first] -= 3;
            boolean ok = canExtractSets(counts, remaining - 1);
            counts[first] += 3;
            if (ok) {
                return true;
            }
        }
        if (canStartRun(counts, first)) {
            counts[first]--;
            counts[first + 1]--;
            counts[first + 2]--;
            boolean ok = canExtractSets(counts, remaining - 1);
            counts[first]++;
            counts[first + 1]++;
            counts[first + 2]++;
            return ok;
        }
        return false;
    }

    private static boolean canStartRun(int[] counts, int value) {
        return value < 27 && value % 9 <= 6 && counts[value + 1] > 0 && counts[value + 2] > 0;
    }

    private static int firstPresent(int[] counts) {
        for (int value = 0; value < counts.length; value++) {
            if (counts[value] > 0) {
                return value;
            }
        }
        return -1;
    }

    /**
     * 七对子：恰好 7 种牌各 2 张
     */
    private static List<Integer> sevenPairs(int[] counts) {
        List<Integer> pairs = new ArrayList<>();
        for (int value = 0; value < counts.length; value++) {
            if (counts[value] == 0) {
                continue;
            }
            if (counts[value] != 2) {
                return null;
            }
            pairs.add(value);
        }
        return pairs.size() == 7 ? pairs : null;
    }

    /**
     * 国士无双：13 种幺九牌齐全、其中一种两张、没有其他牌；返回成对的那种牌，不成立返回 -1
     */
    private static int thirteenOrphansPair(int[] counts) {
        int total = 0;
        for (int count : counts) {
            total += count;
        }
        if (total != 14) {
            return -1;
        }
        int pair = -1;
        for (int value : ORPHANS) {
            if (counts[value] == 0) {
                return -1;
            }
            if (counts[value] == 2) {
                pair = value;
            } else if (counts[value] != 1) {
                return -1;
            }
        }
        // 13 种各至少 1 张 + 总数 14 张，剩下那一张只能是其中之一
        return pair;
    }
}
