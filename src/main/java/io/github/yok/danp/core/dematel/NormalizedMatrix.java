package io.github.yok.danp.core.dematel;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 正規化直接影響行列 {@code D = X / s} と、正規化に用いた尺度 s を保持するクラスです。
 */
@Value
public class NormalizedMatrix {

    /**
     * 正規化直接影響行列 D です。
     */
    DMatrixRMaj matrix;

    /**
     * 正規化尺度 {@code s = max(最大行和, 最大列和)} です。
     */
    double scale;
}
