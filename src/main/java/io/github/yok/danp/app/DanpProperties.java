package io.github.yok.danp.app;

import io.github.yok.danp.core.analysis.AnalysisMode;
import io.github.yok.danp.core.danp.DimensionWeighting;
import io.github.yok.danp.core.danp.SelfBlockPolicy;
import io.github.yok.danp.core.error.InvalidInputException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;
import javax.validation.constraints.NotNull;
import javax.validation.constraints.Positive;
import javax.validation.constraints.PositiveOrZero;
import lombok.Data;
import lombok.ToString;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * danp-solver の設定値（danp.*）を保持するクラスです。
 *
 * <p>
 * application.yml などから読み込まれ、CLI 実行時の初期化に使用します。
 * </p>
 */
@Data
@ToString(onlyExplicitlyIncluded = true)
@Validated
@ConfigurationProperties(prefix = "danp")
public class DanpProperties {

    /**
     * 総影響行列ソルバの設定です。
     */
    @Valid
    private Solver solver = new Solver();

    /**
     * 超行列の設定です。
     */
    @Valid
    private Supermatrix supermatrix = new Supermatrix();

    /**
     * 極限超行列の設定です。
     */
    @Valid
    private Limit limit = new Limit();

    /**
     * 解析セッションの一覧です（記載順に実行します）。
     */
    @Valid
    private List<Analysis> analyses = new ArrayList<>();

    /**
     * 出力設定です。
     */
    @Valid
    private Output output = new Output();

    /**
     * 設定値を YAML 風の複数行文字列に整形して返します。
     *
     * @return 設定値の整形文字列です
     */
    @ToString.Include(name = "danp")
    public String toMultilineString() {
        String nl = System.lineSeparator();

        Solver s = getSolver();
        Supermatrix sm = getSupermatrix();
        Limit l = getLimit();
        Output o = getOutput();

        StringBuilder sb = new StringBuilder(256).append(nl);

        appendSection(sb, nl, "solver",
                // singularityTolerance: (I - D) の LU 分解品質の下限
                "singularityTolerance", s.getSingularityTolerance(),
                // residualTolerance: (I - D)T - D の残差の上限
                "residualTolerance", s.getResidualTolerance());

        appendSection(sb, nl, "supermatrix",
                // selfBlockPolicy: 対角ブロックの扱い
                "selfBlockPolicy", sm.getSelfBlockPolicy(),
                // dimensionWeighting: ブロック重みの決め方
                "dimensionWeighting", sm.getDimensionWeighting(),
                // transposeInfluence: T^T から組み立てるかどうか
                "transposeInfluence", sm.isTransposeInfluence());

        appendSection(sb, nl, "limit",
                // tolerance: 連続する反復の差の許容値
                "tolerance", l.getTolerance(),
                // maxIterations: 二乗の最大回数
                "maxIterations", l.getMaxIterations(),
                // columnTolerance: 極限超行列の列どうしの一致の許容値
                "columnTolerance", l.getColumnTolerance());

        List<Object> sessions = new ArrayList<>();
        for (Analysis a : getAnalyses()) {
            sessions.add(a.getName());
            sessions.add(a.getMode() + (a.getMatrixFile() != null ? " (" + a.getMatrixFile() + ")"
                    : " (" + (a.getLabels() == null ? 0 : a.getLabels().size()) + " factors)"));
        }
        appendSection(sb, nl, "analyses", sessions.toArray());

        appendSection(sb, nl, "output",
                // dir: 出力先ディレクトリ
                "dir", o.getDir(),
                // enabled: CSV 出力を行うかどうか
                "enabled", o.isEnabled());

        return sb.toString();
    }

    /**
     * セクション名と (key, value) ペア列を、YAML 風の複数行テキストとして追記します。
     *
     * @param sb 追記先バッファです
     * @param nl 改行文字列です
     * @param section セクション名です
     * @param kvPairs key1, value1, key2, value2, ... の順で渡すペア列です
     */
    private static void appendSection(StringBuilder sb, String nl, String section,
            Object... kvPairs) {
        sb.append("  ").append(section).append(":").append(nl);
        for (int i = 0; i < kvPairs.length; i += 2) {
            String key = String.valueOf(kvPairs[i]);
            Object val = (i + 1 < kvPairs.length) ? kvPairs[i + 1] : null;
            sb.append("    ").append(key).append(": ").append(val).append(nl);
        }
    }

    @Data
    public static class Solver {

        /**
         * (I - D) の LU 分解品質の下限です。
         */
        @PositiveOrZero
        private double singularityTolerance = 1e-12;

        /**
         * 残差 {@code max |(I - D)T - D|} の上限です。
         */
        @Positive
        private double residualTolerance = 1e-9;
    }

    @Data
    public static class Supermatrix {

        /**
         * 対角ブロック（同じ次元どうし）の扱いです。
         */
        @NotNull
        private SelfBlockPolicy selfBlockPolicy = SelfBlockPolicy.NORMALIZE;

        /**
         * ブロック重みの決め方です。
         */
        @NotNull
        private DimensionWeighting dimensionWeighting = DimensionWeighting.TOTAL_INFLUENCE;

        /**
         * T の代わりに T^T（与えた影響）から超行列を組み立てるかどうかです。
         */
        private boolean transposeInfluence = false;
    }

    @Data
    public static class Limit {

        /**
         * 連続する反復の差の許容値です。
         */
        @Positive
        private double tolerance = 1e-10;

        /**
         * 二乗の最大回数です。
         */
        @Min(1)
        private int maxIterations = 64;

        /**
         * 極限超行列の列どうしの一致に求める許容値です。
         */
        @Positive
        private double columnTolerance = 1e-8;
    }

    /**
     * 解析セッション 1 件の設定です。
     *
     * <p>
     * 行列は {@code matrix}（インライン）か {@code matrixFile}（CSV）のどちらか一方で指定します。
     * </p>
     */
    @Data
    public static class Analysis {

        /**
         * セッション名です（出力ファイル名に使用します）。
         */
        @NotBlank
        private String name;

        /**
         * 解析の種類です。
         */
        @NotNull
        private AnalysisMode mode;

        /**
         * 因子ラベルです。
         */
        private List<String> labels = new ArrayList<>();

        /**
         * 直接影響行列（インライン）です。
         */
        private List<List<Double>> matrix = new ArrayList<>();

        /**
         * 直接影響行列の CSV ファイルです。
         */
        private String matrixFile;

        /**
         * 次元グルーピングです（INDICATORS のみ）。
         */
        @Valid
        private List<Group> grouping = new ArrayList<>();

        /**
         * グルーピングを 次元名 → 指標ラベル一覧 に変換します。
         *
         * @return 指定順を保った対応です（未指定なら null）
         * @throws InvalidInputException 次元名が重複している場合に発生します
         */
        public Map<String, List<String>> groupingAsMap() {
            if (grouping == null || grouping.isEmpty()) {
                return null;
            }
            Map<String, List<String>> map = new LinkedHashMap<>();
            for (Group g : grouping) {
                if (map.containsKey(g.getDimension())) {
                    throw new InvalidInputException("grouping", "次元名が重複しています: " + g.getDimension());
                }
                map.put(g.getDimension(), g.getIndicators());
            }
            return map;
        }
    }

    @Data
    public static class Group {

        /**
         * 次元名です。
         */
        @NotBlank
        private String dimension;

        /**
         * 次元に属する指標ラベルです。
         */
        private List<String> indicators = new ArrayList<>();
    }

    @Data
    public static class Output {

        /**
         * 出力先ディレクトリです。
         */
        private String dir = "./out";

        /**
         * CSV 出力を行うかどうかです。
         */
        private boolean enabled = true;
    }
}
