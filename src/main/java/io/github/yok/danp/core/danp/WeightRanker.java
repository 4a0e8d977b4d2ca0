package io.github.yok.danp.core.danp;

import com.google.common.base.Preconditions;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * 重みを大きい順に並べ、1 始まりの優先順位を付けるクラスです。
 *
 * <p>
 * 同じ重みの指標は元のラベル順を保ちます。
 * </p>
 */
public final class WeightRanker {

    /**
     * 優先順位付きの一覧を作ります。
     *
     * @param weights 正規化した重みです（ラベル順）
     * @param labels 指標ラベルです
     * @param grouping 次元グルーピングです
     * @return 重みの大きい順の一覧です
     */
    public List<RankedIndicator> rank(double[] weights, List<String> labels,
            DimensionGrouping grouping) {
        Preconditions.checkNotNull(weights, "weights は null 不可です");
        Preconditions.checkNotNull(labels, "labels は null 不可です");
        Preconditions.checkNotNull(grouping, "grouping は null 不可です");
        Preconditions.checkArgument(weights.length == labels.size(), "weights と labels の長さが一致しません: %s vs %s",
                weights.length, labels.size());

        List<Integer> order = new ArrayList<>(weights.length);
        for (int i = 0; i < weights.length; i++) {
            order.add(i);
        }
        // List.sort は安定ソートです
        order.sort(Comparator.comparingDouble((Integer i) -> weights[i]).reversed());

        List<RankedIndicator> ranking = new ArrayList<>(weights.length);
        for (int p = 0; p < order.size(); p++) {
            int idx = order.get(p);
            ranking.add(new RankedIndicator(p + 1, labels.get(idx), grouping.dimensionOf(idx).getName(),
                    weights[idx], idx));
        }
        return Collections.unmodifiableList(ranking);
    }
}
