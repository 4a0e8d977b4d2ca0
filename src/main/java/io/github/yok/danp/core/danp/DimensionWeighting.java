package io.github.yok.danp.core.danp;

/**
 * 重み付き超行列を作るときの、ブロックごとの重みの決め方です。
 */
public enum DimensionWeighting {

    /**
     * 次元レベルの総影響行列（ブロック平均）を列方向に正規化した値を使います。
     */
    TOTAL_INFLUENCE,

    /**
     * すべてのブロックに 1/k を使います。
     */
    EQUAL
}
