package io.github.yok.danp.core.danp;

import lombok.Value;

/**
 * 優先順位付きの指標の重みです。
 */
@Value
public class RankedIndicator {

    /**
     * 優先順位です（1 始まり、重みの大きい順）。
     */
    int priority;

    /**
     * 指標ラベルです。
     */
    String label;

    /**
     * 指標が属する次元名です。
     */
    String dimension;

    /**
     * 正規化した重みです（全指標の和が 1）。
     */
    double weight;

    /**
     * 元のラベル順での添字です。
     */
    int index;
}
