package io.github.yok.danp.core.dematel;

/**
 * 因果図における因子の役割です。
 *
 * <p>
 * 関係度 {@code D - R} が正なら原因、0 または負なら結果とします。 0 を「中立」として丸めることはしません。
 * </p>
 */
public enum FactorRole {

    /**
     * 原因（関係度が正）です。
     */
    CAUSE,

    /**
     * 結果（関係度が 0 以下）です。
     */
    EFFECT;

    /**
     * 関係度から役割を決めます。
     *
     * @param relation 関係度 {@code D - R} です
     * @return 関係度が正なら {@link #CAUSE}、それ以外は {@link #EFFECT} です
     */
    public static FactorRole of(double relation) {
        return relation > 0.0 ? CAUSE : EFFECT;
    }
}
