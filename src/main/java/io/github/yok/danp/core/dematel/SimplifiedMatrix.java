package io.github.yok.danp.core.dematel;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 閾値未満の要素を 0 にした表示用の総影響行列と、その閾値です。
 */
@Value
public class SimplifiedMatrix {

    /**
     * 簡略化した総影響行列です。
     */
    DMatrixRMaj matrix;

    /**
     * 閾値 α（総影響行列の全要素の平均）です。
     */
    double threshold;
}
