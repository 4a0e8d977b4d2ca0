package io.github.yok.danp.core.dematel;

import com.google.common.base.Preconditions;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 総影響行列 T を平均値 α で閾値処理し、表示用の簡略化行列を作るクラスです。
 *
 * <p>
 * α は対角成分を含む全 n² 要素の平均です。 {@code T[i][j] >= α} の要素を残し、それ以外を 0 にします。 T がすべて 0 の場合は α = 0
 * となり、簡略化行列は T と同じになります。 簡略化行列は表示専用で、中心度・関係度や重みの計算には使いません。
 * </p>
 */
public final class TotalInfluenceSimplifier {

    /**
     * 平均値を閾値として簡略化します。
     *
     * @param totalInfluence 総影響行列 T です（変更しません）
     * @return 簡略化行列と閾値です
     */
    public SimplifiedMatrix simplify(DMatrixRMaj totalInfluence) {
        double alpha = threshold(totalInfluence);
        return new SimplifiedMatrix(simplify(totalInfluence, alpha), alpha);
    }

    /**
     * 閾値 α（全要素の平均）を返します。
     *
     * @param totalInfluence 総影響行列 T です
     * @return 閾値 α です
     */
    public double threshold(DMatrixRMaj totalInfluence) {
        Preconditions.checkNotNull(totalInfluence, "totalInfluence は null 不可です");
        Preconditions.checkArgument(totalInfluence.getNumElements() > 0, "totalInfluence が空です");
        return CommonOps_DDRM.elementSum(totalInfluence) / totalInfluence.getNumElements();
    }

    /**
     * 指定した閾値で簡略化します。
     *
     * @param matrix 対象行列です（変更しません）
     * @param alpha 閾値です
     * @return {@code alpha} 未満の要素を 0 にした新しい行列です
     */
    public DMatrixRMaj simplify(DMatrixRMaj matrix, double alpha) {
        Preconditions.checkNotNull(matrix, "matrix は null 不可です");
        DMatrixRMaj out = new DMatrixRMaj(matrix.numRows, matrix.numCols);
        for (int i = 0; i < matrix.getNumElements(); i++) {
            double v = matrix.get(i);
            out.set(i, v >= alpha ? v : 0.0);
        }
        return out;
    }
}
