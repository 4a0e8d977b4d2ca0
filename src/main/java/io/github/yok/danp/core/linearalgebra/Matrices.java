package io.github.yok.danp.core.linearalgebra;

import com.google.common.base.Preconditions;
import org.ejml.data.DMatrixRMaj;

/**
 * {@code double[][]} と {@link DMatrixRMaj} の相互変換、および行和・列和などの小さな行列演算をまとめたクラスです。
 *
 * <p>
 * いずれのメソッドも引数を変更せず、新しい配列・行列を返します。
 * </p>
 */
public final class Matrices {

    private Matrices() {
    }

    /**
     * 2 次元配列をコピーして {@link DMatrixRMaj} に変換します。
     *
     * @param values 矩形の 2 次元配列です
     * @return 新しい行列です
     */
    public static DMatrixRMaj fromArray(double[][] values) {
        Preconditions.checkNotNull(values, "values は null 不可です");
        int rows = values.length;
        int cols = rows == 0 ? 0 : values[0].length;
        DMatrixRMaj m = new DMatrixRMaj(rows, cols);
        for (int i = 0; i < rows; i++) {
            Preconditions.checkArgument(values[i].length == cols, "矩形でない配列です: row=%s", i);
            for (int j = 0; j < cols; j++) {
                m.set(i, j, values[i][j]);
            }
        }
        return m;
    }

    /**
     * 行列を新しい 2 次元配列に変換します。
     *
     * @param m 行列です
     * @return 2 次元配列です
     */
    public static double[][] toArray(DMatrixRMaj m) {
        double[][] out = new double[m.numRows][m.numCols];
        for (int i = 0; i < m.numRows; i++) {
            for (int j = 0; j < m.numCols; j++) {
                out[i][j] = m.get(i, j);
            }
        }
        return out;
    }

    /**
     * 各行の和を返します。
     *
     * @param m 行列です
     * @return 行和の配列です（長さ = 行数）
     */
    public static double[] rowSums(DMatrixRMaj m) {
        double[] sums = new double[m.numRows];
        for (int i = 0; i < m.numRows; i++) {
            double s = 0.0;
            for (int j = 0; j < m.numCols; j++) {
                s += m.get(i, j);
            }
            sums[i] = s;
        }
        return sums;
    }

    /**
     * 各列の和を返します。
     *
     * @param m 行列です
     * @return 列和の配列です（長さ = 列数）
     */
    public static double[] columnSums(DMatrixRMaj m) {
        double[] sums = new double[m.numCols];
        for (int i = 0; i < m.numRows; i++) {
            for (int j = 0; j < m.numCols; j++) {
                sums[j] += m.get(i, j);
            }
        }
        return sums;
    }

    /**
     * 同じ形状の 2 行列について、要素ごとの差の絶対値の最大を返します。
     *
     * @param a 行列 1 です
     * @param b 行列 2 です
     * @return {@code max |a(i,j) - b(i,j)|} です
     */
    public static double maxAbsDifference(DMatrixRMaj a, DMatrixRMaj b) {
        Preconditions.checkArgument(a.numRows == b.numRows && a.numCols == b.numCols,
                "行列の形状が一致しません: %sx%s vs %sx%s", a.numRows, a.numCols, b.numRows, b.numCols);
        double max = 0.0;
        for (int i = 0; i < a.numRows; i++) {
            for (int j = 0; j < a.numCols; j++) {
                max = Math.max(max, Math.abs(a.get(i, j) - b.get(i, j)));
            }
        }
        return max;
    }

    /**
     * 配列の最大値を返します。
     *
     * @param a 対象配列です（長さ 1 以上）
     * @return 最大値です
     */
    public static double max(double[] a) {
        double m = a[0];
        for (int i = 1; i < a.length; i++) {
            m = Math.max(m, a[i]);
        }
        return m;
    }
}
