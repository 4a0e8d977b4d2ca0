package io.github.yok.danp.core.danp;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.error.EmptyGroupException;
import io.github.yok.danp.core.error.InvalidInputException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

/**
 * 指標ラベルを次元に分割したグルーピングです。
 *
 * <p>
 * 各次元は 1 つ以上の指標を持ち、すべての指標はちょうど 1 つの次元に属します。 次元の順序は指定された順序を保ち、次元内の指標は元のラベル順に並べます。
 * </p>
 */
@Getter
public final class DimensionGrouping {

    /**
     * 次元の一覧です（指定順）。
     */
    private final List<Dimension> dimensions;

    /**
     * 指標の添字から次元の添字への対応です。
     */
    private final int[] dimensionOfIndicator;

    private DimensionGrouping(List<Dimension> dimensions, int[] dimensionOfIndicator) {
        this.dimensions = dimensions;
        this.dimensionOfIndicator = dimensionOfIndicator;
    }

    /**
     * 次元名 → 指標ラベル一覧 の対応からグルーピングを作成します。
     *
     * @param groups 次元名 → 指標ラベル一覧 です（反復順を次元の順序とします）
     * @param labels 指標ラベルです（行列の添字順）
     * @return グルーピングです
     * @throws EmptyGroupException 指標を 1 つも持たない次元がある場合に発生します
     * @throws InvalidInputException 未知のラベル、重複割り当て、未割り当てのラベルがある場合に発生します
     */
    public static DimensionGrouping of(Map<String, List<String>> groups, List<String> labels) {
        Preconditions.checkNotNull(labels, "labels は null 不可です");
        if (groups == null || groups.isEmpty()) {
            throw new InvalidInputException("grouping", "次元が 1 つも指定されていません");
        }

        Map<String, Integer> indexOfLabel = new HashMap<>();
        for (int i = 0; i < labels.size(); i++) {
            indexOfLabel.put(labels.get(i), i);
        }

        int[] owner = new int[labels.size()];
        Arrays.fill(owner, -1);

        List<Dimension> dimensions = new ArrayList<>(groups.size());
        for (Map.Entry<String, List<String>> e : groups.entrySet()) {
            String name = e.getKey();
            if (name == null || name.isBlank()) {
                throw new InvalidInputException("grouping", "次元名が空です");
            }
            List<String> members = e.getValue();
            if (members == null || members.isEmpty()) {
                throw new EmptyGroupException(name);
            }

            int dimensionIndex = dimensions.size();
            List<Integer> indices = new ArrayList<>(members.size());
            for (String label : members) {
                Integer idx = indexOfLabel.get(label);
                if (idx == null) {
                    throw new InvalidInputException("grouping",
                            "未知のラベルです: " + label + "（次元 " + name + "）");
                }
                if (owner[idx] >= 0) {
                    throw new InvalidInputException("grouping", "ラベルが複数の次元に割り当てられています: "
                            + label + "（" + dimensions.get(owner[idx]).getName() + ", " + name + "）");
                }
                owner[idx] = dimensionIndex;
                indices.add(idx);
            }
            Collections.sort(indices);
            dimensions.add(new Dimension(name, Collections.unmodifiableList(indices)));
        }

        for (int i = 0; i < owner.length; i++) {
            if (owner[i] < 0) {
                throw new InvalidInputException("grouping",
                        "どの次元にも属さないラベルがあります: " + labels.get(i));
            }
        }

        return new DimensionGrouping(Collections.unmodifiableList(dimensions), owner);
    }

    /**
     * 次元数を返します。
     *
     * @return 次元数 k です
     */
    public int dimensionCount() {
        return dimensions.size();
    }

    /**
     * 指標数を返します。
     *
     * @return 指標数 n です
     */
    public int indicatorCount() {
        return dimensionOfIndicator.length;
    }

    /**
     * 指標が属する次元を返します。
     *
     * @param indicatorIndex 指標の添字です
     * @return 次元です
     */
    public Dimension dimensionOf(int indicatorIndex) {
        Preconditions.checkElementIndex(indicatorIndex, dimensionOfIndicator.length, "indicatorIndex");
        return dimensions.get(dimensionOfIndicator[indicatorIndex]);
    }
}
