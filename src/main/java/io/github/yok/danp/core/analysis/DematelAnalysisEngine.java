package io.github.yok.danp.core.analysis;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.danp.DimensionGrouping;
import io.github.yok.danp.core.danp.LimitingSupermatrix;
import io.github.yok.danp.core.danp.LimitingSupermatrixSolver;
import io.github.yok.danp.core.danp.RankedIndicator;
import io.github.yok.danp.core.danp.Supermatrix;
import io.github.yok.danp.core.danp.SupermatrixBuilder;
import io.github.yok.danp.core.danp.WeightRanker;
import io.github.yok.danp.core.dematel.DirectInfluenceNormalizer;
import io.github.yok.danp.core.dematel.DirectInfluenceValidator;
import io.github.yok.danp.core.dematel.NormalizedMatrix;
import io.github.yok.danp.core.dematel.ProminenceRelation;
import io.github.yok.danp.core.dematel.ProminenceRelationCalculator;
import io.github.yok.danp.core.dematel.SimplifiedMatrix;
import io.github.yok.danp.core.dematel.TotalInfluenceSimplifier;
import io.github.yok.danp.core.dematel.TotalInfluenceSolver;
import io.github.yok.danp.core.error.InvalidInputException;
import io.github.yok.danp.core.linearalgebra.Matrices;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;

/**
 * DEMATEL / DANP 解析のパイプラインを実行するクラスです。
 *
 * <p>
 * 検証 → 正規化 → 総影響行列 → 中心度・関係度 → 簡略化 を常に実行し、グルーピングが指定された場合は続けて 超行列の組み立て → 極限超行列 →
 * 優先順位付け を実行します。
 * </p>
 *
 * <p>
 * 状態を持たないため、複数の呼び出し元から同時に使用できます。 入力の配列とリストはコピーしてから使い、変更しません。 失敗した場合は部分的な結果を返さず例外を送出します。
 * </p>
 */
@Getter
@Slf4j
public final class DematelAnalysisEngine {

    /**
     * 入力検証です。
     */
    private final DirectInfluenceValidator validator;

    /**
     * 正規化です。
     */
    private final DirectInfluenceNormalizer normalizer;

    /**
     * 総影響行列の計算です。
     */
    private final TotalInfluenceSolver totalInfluenceSolver;

    /**
     * 中心度・関係度の計算です。
     */
    private final ProminenceRelationCalculator prominenceRelationCalculator;

    /**
     * 総影響行列の簡略化です。
     */
    private final TotalInfluenceSimplifier simplifier;

    /**
     * 超行列の組み立てです。
     */
    private final SupermatrixBuilder supermatrixBuilder;

    /**
     * 極限超行列の計算です。
     */
    private final LimitingSupermatrixSolver limitingSupermatrixSolver;

    /**
     * 優先順位付けです。
     */
    private final WeightRanker weightRanker;

    /**
     * エンジンを生成します。
     *
     * @param validator 入力検証です
     * @param normalizer 正規化です
     * @param totalInfluenceSolver 総影響行列の計算です
     * @param prominenceRelationCalculator 中心度・関係度の計算です
     * @param simplifier 簡略化です
     * @param supermatrixBuilder 超行列の組み立てです
     * @param limitingSupermatrixSolver 極限超行列の計算です
     * @param weightRanker 優先順位付けです
     * @throws NullPointerException いずれかが null の場合に発生します
     */
    public DematelAnalysisEngine(DirectInfluenceValidator validator,
            DirectInfluenceNormalizer normalizer, TotalInfluenceSolver totalInfluenceSolver,
            ProminenceRelationCalculator prominenceRelationCalculator,
            TotalInfluenceSimplifier simplifier, SupermatrixBuilder supermatrixBuilder,
            LimitingSupermatrixSolver limitingSupermatrixSolver, WeightRanker weightRanker) {
        this.validator = Preconditions.checkNotNull(validator, "validator は null 不可です");
        this.normalizer = Preconditions.checkNotNull(normalizer, "normalizer は null 不可です");
        this.totalInfluenceSolver =
                Preconditions.checkNotNull(totalInfluenceSolver, "totalInfluenceSolver は null 不可です");
        this.prominenceRelationCalculator = Preconditions.checkNotNull(prominenceRelationCalculator,
                "prominenceRelationCalculator は null 不可です");
        this.simplifier = Preconditions.checkNotNull(simplifier, "simplifier は null 不可です");
        this.supermatrixBuilder =
                Preconditions.checkNotNull(supermatrixBuilder, "supermatrixBuilder は null 不可です");
        this.limitingSupermatrixSolver = Preconditions.checkNotNull(limitingSupermatrixSolver,
                "limitingSupermatrixSolver は null 不可です");
        this.weightRanker = Preconditions.checkNotNull(weightRanker, "weightRanker は null 不可です");
    }

    /**
     * 解析を実行します。
     *
     * @param request 解析の入力です（変更しません）
     * @return 解析結果です
     * @throws io.github.yok.danp.core.error.DanpAnalysisException 解析に失敗した場合に発生します
     */
    public AnalysisResult analyze(AnalysisRequest request) {
        Preconditions.checkNotNull(request, "request は null 不可です");

        AnalysisMode mode = request.getMode();
        if (mode == null) {
            throw new InvalidInputException("mode", "解析の種類が指定されていません");
        }

        // 1) 検証（入力のコピーを検証し、以降はコピーだけを使います）
        double[][] matrix = copyOf(request.getMatrix());
        List<String> labels =
                request.getLabels() == null ? null : new ArrayList<>(request.getLabels());
        validator.validate(matrix, labels);
        labels = Collections.unmodifiableList(labels);
        DimensionGrouping grouping = resolveGrouping(request, labels);

        DMatrixRMaj x = Matrices.fromArray(matrix);

        // 2) 正規化
        NormalizedMatrix normalized = normalizer.normalize(x);
        log.info("直接影響行列を正規化しました。n={}、尺度 s={}", labels.size(), fmt5(normalized.getScale()));

        // 3) 総影響行列
        DMatrixRMaj total = totalInfluenceSolver.solve(normalized.getMatrix());

        // 4) 中心度・関係度
        ProminenceRelation pr = prominenceRelationCalculator.calculate(total);

        // 5) 簡略化（表示用）
        SimplifiedMatrix simplified = simplifier.simplify(total);
        log.info("総影響行列を簡略化しました。閾値 α={}", fmt5(simplified.getThreshold()));

        // 6) 7) DANP
        DanpWeights danp = grouping == null ? null : weigh(total, grouping, labels);

        return new AnalysisResult(mode, labels, normalized.getScale(), Matrices.toArray(total),
                Matrices.toArray(simplified.getMatrix()), simplified.getThreshold(), pr.getD(),
                pr.getR(), pr.getProminence(), pr.getRelation(), pr.getRoles(), danp);
    }

    /**
     * 解析の種類とグルーピング指定の整合を確認し、グルーピングを作成します。
     *
     * @param request 解析の入力です
     * @param labels 因子ラベルです
     * @return グルーピングです（DIMENSIONS では null）
     */
    private static DimensionGrouping resolveGrouping(AnalysisRequest request, List<String> labels) {
        if (request.getMode() == AnalysisMode.DIMENSIONS) {
            if (request.getGrouping() != null) {
                throw new InvalidInputException("grouping", "DIMENSIONS ではグルーピングを指定できません");
            }
            return null;
        }
        if (request.getGrouping() == null) {
            throw new InvalidInputException("grouping", "INDICATORS ではグルーピングが必須です");
        }
        return DimensionGrouping.of(request.getGrouping(), labels);
    }

    /**
     * 総影響行列から DANP の重みを求めます。
     *
     * @param total 総影響行列です
     * @param grouping 次元グルーピングです
     * @param labels 指標ラベルです
     * @return DANP の結果です
     */
    private DanpWeights weigh(DMatrixRMaj total, DimensionGrouping grouping, List<String> labels) {
        Supermatrix supermatrix = supermatrixBuilder.build(total, grouping);
        LimitingSupermatrix limit = limitingSupermatrixSolver.solve(supermatrix.getWeighted());
        List<RankedIndicator> ranking = weightRanker.rank(limit.getWeights(), labels, grouping);

        RankedIndicator top = ranking.get(0);
        log.info("DANP の重みを求めました。最上位={}（重み={}）、反復={}", top.getLabel(), fmt5(top.getWeight()),
                limit.getIterations());

        return new DanpWeights(grouping, Matrices.toArray(supermatrix.getUnweighted()),
                Matrices.toArray(supermatrix.getDimensionInfluence()),
                Matrices.toArray(supermatrix.getWeighted()), Matrices.toArray(limit.getMatrix()),
                limit.getWeights(), ranking, limit.getIterations());
    }

    /**
     * 行列を行ごとにコピーします。null の行は null のまま残します。
     *
     * @param matrix 行列です（null 可）
     * @return コピーです
     */
    private static double[][] copyOf(double[][] matrix) {
        if (matrix == null) {
            return null;
        }
        double[][] copy = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            copy[i] = matrix[i] == null ? null : matrix[i].clone();
        }
        return copy;
    }

    private static String fmt5(double v) {
        return String.format(Locale.ROOT, "%.5f", v);
    }
}
