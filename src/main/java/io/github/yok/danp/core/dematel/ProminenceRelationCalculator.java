package io.github.yok.danp.core.dematel;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.linearalgebra.Matrices;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.ejml.data.DMatrixRMaj;

/**
 * 総影響行列 T から、影響度 D・被影響度 R・中心度 D+R・関係度 D-R を計算するクラスです。
 */
public final class ProminenceRelationCalculator {

    /**
     * 中心度・関係度を計算します。
     *
     * @param totalInfluence 総影響行列 T です（正方、変更しません）
     * @return 因子ごとの計算結果です
     */
    public ProminenceRelation calculate(DMatrixRMaj totalInfluence) {
        Preconditions.checkNotNull(totalInfluence, "totalInfluence は null 不可です");
        Preconditions.checkArgument(totalInfluence.numRows == totalInfluence.numCols,
                "totalInfluence は正方行列である必要があります: %sx%s", totalInfluence.numRows,
                totalInfluence.numCols);

        double[] d = Matrices.rowSums(totalInfluence);
        double[] r = Matrices.columnSums(totalInfluence);

        int n = d.length;
        double[] prominence = new double[n];
        double[] relation = new double[n];
        List<FactorRole> roles = new ArrayList<>(n);

        for (int i = 0; i < n; i++) {
            prominence[i] = d[i] + r[i];
            relation[i] = d[i] - r[i];
            roles.add(FactorRole.of(relation[i]));
        }

        return new ProminenceRelation(d, r, prominence, relation, Collections.unmodifiableList(roles));
    }
}
