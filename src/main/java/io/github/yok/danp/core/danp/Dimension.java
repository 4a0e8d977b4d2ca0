package io.github.yok.danp.core.danp;

import java.util.List;
import lombok.Value;

/**
 * 指標をまとめる次元（クラスタ）です。
 */
@Value
public class Dimension {

    /**
     * 次元名です。
     */
    String name;

    /**
     * 次元に属する指標の添字です（元のラベル順で昇順）。
     */
    List<Integer> indicatorIndices;

    /**
     * 次元に属する指標数を返します。
     *
     * @return 指標数です
     */
    public int size() {
        return indicatorIndices.size();
    }
}
