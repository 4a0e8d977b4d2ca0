package io.github.yok.danp.out;

import io.github.yok.danp.core.analysis.AnalysisResult;

/**
 * 解析結果を出力する処理のインタフェースです。
 *
 * <p>
 * 出力の命名に使うセッション名を受け取ります。
 * </p>
 */
public interface ResultWriter {

    /**
     * 解析結果を出力します。
     *
     * @param name 解析セッション名です
     * @param result 解析結果です
     */
    void write(String name, AnalysisResult result);
}
