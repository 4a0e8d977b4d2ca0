package io.github.yok.danp.core.analysis;

/**
 * 解析セッションの種類です。
 */
public enum AnalysisMode {

    /**
     * 次元（4×4 など）の DEMATEL のみを行います。グルーピングは指定できません。
     */
    DIMENSIONS,

    /**
     * 指標（8×8 など）の DEMATEL と DANP の重み付けを行います。グルーピングが必須です。
     */
    INDICATORS
}
