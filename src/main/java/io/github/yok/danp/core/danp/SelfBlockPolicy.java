package io.github.yok.danp.core.danp;

/**
 * 超行列の対角ブロック（同じ次元どうし）の扱いです。
 */
public enum SelfBlockPolicy {

    /**
     * 他のブロックと同じく列ごとに正規化します。
     */
    NORMALIZE,

    /**
     * すべて 0 にします（次元内の相互影響を無視します）。
     */
    ZERO,

    /**
     * 単位行列にします。
     */
    IDENTITY
}
