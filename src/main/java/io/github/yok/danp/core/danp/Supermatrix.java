package io.github.yok.danp.core.danp;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 総影響行列から組み立てた超行列一式です。
 */
@Value
public class Supermatrix {

    /**
     * 非加重超行列 W です（ブロックごとに列和 1、列和 0 の列は 0 のまま）。
     */
    DMatrixRMaj unweighted;

    /**
     * 次元レベルの総影響行列 T_D です（k×k、ブロック平均）。
     */
    DMatrixRMaj dimensionInfluence;

    /**
     * 重み付き超行列です（列確率行列、すべての列の和が 1）。
     */
    DMatrixRMaj weighted;
}
