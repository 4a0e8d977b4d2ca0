package io.github.yok.danp.in;

import java.util.List;
import lombok.Value;

/**
 * ラベル付きの直接影響行列です。
 */
@Value
public class LabelledMatrix {

    /**
     * 因子ラベルです。
     */
    List<String> labels;

    /**
     * 直接影響行列です。
     */
    double[][] matrix;
}
