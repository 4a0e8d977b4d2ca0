package io.github.yok.danp.core.danp;

import com.google.common.base.Preconditions;
import java.util.List;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 総影響行列 T と次元グルーピングから、DANP の非加重超行列と重み付き超行列を組み立てるクラスです。
 *
 * <p>
 * 行次元 g・列次元 h の組ごとに T の該当ブロック（g の行 × h の列）を取り出し、列ごとに和が 1 になるよう正規化します。 非加重超行列では列和が 0 の列は 0
 * のまま残し、重み付き超行列ではその列を {@code 1/n} で埋めます。 指標の並びは元のラベル順を保ちます。
 * </p>
 *
 * <p>
 * {@code transposeInfluence=true} の場合は T の代わりに T^T を使います。 これは「行ごとに正規化してから転置する」流儀と同じ結果になります。
 * </p>
 */
@Getter
@Slf4j
public final class SupermatrixBuilder {

    /**
     * 対角ブロックの扱いです。
     */
    private final SelfBlockPolicy selfBlockPolicy;

    /**
     * ブロック重みの決め方です。
     */
    private final DimensionWeighting dimensionWeighting;

    /**
     * T の代わりに T^T から組み立てるかどうかです。
     */
    private final boolean transposeInfluence;

    /**
     * ビルダを生成します。
     *
     * @param selfBlockPolicy 対角ブロックの扱いです（null 不可）
     * @param dimensionWeighting ブロック重みの決め方です（null 不可）
     * @param transposeInfluence T^T から組み立てるかどうかです
     */
    public SupermatrixBuilder(SelfBlockPolicy selfBlockPolicy, DimensionWeighting dimensionWeighting,
            boolean transposeInfluence) {
        this.selfBlockPolicy = Preconditions.checkNotNull(selfBlockPolicy, "selfBlockPolicy は null 不可です");
        this.dimensionWeighting =
                Preconditions.checkNotNull(dimensionWeighting, "dimensionWeighting は null 不可です");
        this.transposeInfluence = transposeInfluence;
    }

    /**
     * 超行列一式を組み立てます。
     *
     * @param totalInfluence 総影響行列 T です（変更しません）
     * @param grouping 次元グルーピングです（指標数は T の次数と一致が必要です）
     * @return 非加重超行列・次元レベル総影響行列・重み付き超行列です
     */
    public Supermatrix build(DMatrixRMaj totalInfluence, DimensionGrouping grouping) {
        Preconditions.checkNotNull(totalInfluence, "totalInfluence は null 不可です");
        Preconditions.checkNotNull(grouping, "grouping は null 不可です");
        Preconditions.checkArgument(totalInfluence.numRows == totalInfluence.numCols,
                "totalInfluence は正方行列である必要があります: %sx%s", totalInfluence.numRows,
                totalInfluence.numCols);
        Preconditions.checkArgument(grouping.indicatorCount() == totalInfluence.numRows,
                "グルーピングの指標数と行列の次数が一致しません: %s vs %s", grouping.indicatorCount(),
                totalInfluence.numRows);

        DMatrixRMaj source = transposeInfluence ? CommonOps_DDRM.transpose(totalInfluence, null)
                : totalInfluence;

        DMatrixRMaj unweighted = buildUnweighted(source, grouping);
        DMatrixRMaj dimensionInfluence = dimensionInfluence(source, grouping);
        DMatrixRMaj weighted = buildWeighted(unweighted, dimensionInfluence, grouping);

        log.info("超行列を組み立てました。n={}、次元数={}、対角ブロック={}、次元重み={}、転置={}", source.numRows,
                grouping.dimensionCount(), selfBlockPolicy, dimensionWeighting, transposeInfluence);

        return new Supermatrix(unweighted, dimensionInfluence, weighted);
    }

    /**
     * 非加重超行列を組み立てます。
     *
     * @param source 元の行列（T または T^T）です
     * @param grouping 次元グルーピングです
     * @return 非加重超行列です
     */
    private DMatrixRMaj buildUnweighted(DMatrixRMaj source, DimensionGrouping grouping) {
        int n = source.numRows;
        DMatrixRMaj w = new DMatrixRMaj(n, n);

        for (Dimension g : grouping.getDimensions()) {
            for (Dimension h : grouping.getDimensions()) {
                boolean self = g == h;
                if (self && selfBlockPolicy == SelfBlockPolicy.ZERO) {
                    continue;
                }
                if (self && selfBlockPolicy == SelfBlockPolicy.IDENTITY) {
                    for (int idx : g.getIndicatorIndices()) {
                        w.set(idx, idx, 1.0);
                    }
                    continue;
                }
                for (int j : h.getIndicatorIndices()) {
                    double columnSum = 0.0;
                    for (int i : g.getIndicatorIndices()) {
                        columnSum += source.get(i, j);
                    }
                    if (columnSum == 0.0) {
                        continue;
                    }
                    for (int i : g.getIndicatorIndices()) {
                        w.set(i, j, source.get(i, j) / columnSum);
                    }
                }
            }
        }
        return w;
    }

    /**
     * 次元レベルの総影響行列（ブロック平均）を計算します。
     *
     * @param source 元の行列（T または T^T）です
     * @param grouping 次元グルーピングです
     * @return k×k の行列です
     */
    private static DMatrixRMaj dimensionInfluence(DMatrixRMaj source, DimensionGrouping grouping) {
        List<Dimension> dims = grouping.getDimensions();
        int k = dims.size();
        DMatrixRMaj td = new DMatrixRMaj(k, k);
        for (int g = 0; g < k; g++) {
            for (int h = 0; h < k; h++) {
                double s = 0.0;
                for (int i : dims.get(g).getIndicatorIndices()) {
                    for (int j : dims.get(h).getIndicatorIndices()) {
                        s += source.get(i, j);
                    }
                }
                td.set(g, h, s / (dims.get(g).size() * dims.get(h).size()));
            }
        }
        return td;
    }

    /**
     * 非加重超行列の各ブロックに重みを掛け、各列を和 1 に正規化します。
     *
     * <p>
     * 重み付け後に列和が 0 の列（どの指標からも影響を受けない指標）は、すべての要素を {@code 1/n} にします。 これにより重み付き超行列は常に列確率行列になります。
     * </p>
     *
     * @param unweighted 非加重超行列です
     * @param dimensionInfluence 次元レベルの総影響行列です
     * @param grouping 次元グルーピングです
     * @return 重み付き超行列です
     */
    private DMatrixRMaj buildWeighted(DMatrixRMaj unweighted, DMatrixRMaj dimensionInfluence,
            DimensionGrouping grouping) {
        int n = unweighted.numRows;
        int k = grouping.dimensionCount();
        DMatrixRMaj blockWeights = blockWeights(dimensionInfluence, k);

        DMatrixRMaj weighted = new DMatrixRMaj(n, n);
        int[] owner = grouping.getDimensionOfIndicator();
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                weighted.set(i, j, unweighted.get(i, j) * blockWeights.get(owner[i], owner[j]));
            }
        }

        for (int j = 0; j < n; j++) {
            double columnSum = 0.0;
            for (int i = 0; i < n; i++) {
                columnSum += weighted.get(i, j);
            }
            if (columnSum == 0.0) {
                // 影響を受けない指標: 全指標へ均等に配分します
                for (int i = 0; i < n; i++) {
                    weighted.set(i, j, 1.0 / n);
                }
                continue;
            }
            for (int i = 0; i < n; i++) {
                weighted.set(i, j, weighted.get(i, j) / columnSum);
            }
        }
        return weighted;
    }

    /**
     * ブロック (g, h) の重みを計算します。
     *
     * @param dimensionInfluence 次元レベルの総影響行列です
     * @param k 次元数です
     * @return k×k の重み行列（列ごとに和 1、列和 0 の列は 0）です
     */
    private DMatrixRMaj blockWeights(DMatrixRMaj dimensionInfluence, int k) {
        DMatrixRMaj weights = new DMatrixRMaj(k, k);
        if (dimensionWeighting == DimensionWeighting.EQUAL) {
            CommonOps_DDRM.fill(weights, 1.0 / k);
            return weights;
        }
        for (int h = 0; h < k; h++) {
            double columnSum = 0.0;
            for (int g = 0; g < k; g++) {
                columnSum += dimensionInfluence.get(g, h);
            }
            if (columnSum == 0.0) {
                continue;
            }
            for (int g = 0; g < k; g++) {
                weights.set(g, h, dimensionInfluence.get(g, h) / columnSum);
            }
        }
        return weights;
    }
}
