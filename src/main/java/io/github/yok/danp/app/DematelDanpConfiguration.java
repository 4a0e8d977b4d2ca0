package io.github.yok.danp.app;

import io.github.yok.danp.core.analysis.DematelAnalysisEngine;
import io.github.yok.danp.core.danp.LimitingSupermatrixSolver;
import io.github.yok.danp.core.danp.SupermatrixBuilder;
import io.github.yok.danp.core.danp.WeightRanker;
import io.github.yok.danp.core.dematel.DirectInfluenceNormalizer;
import io.github.yok.danp.core.dematel.DirectInfluenceValidator;
import io.github.yok.danp.core.dematel.ProminenceRelationCalculator;
import io.github.yok.danp.core.dematel.TotalInfluenceSimplifier;
import io.github.yok.danp.core.dematel.TotalInfluenceSolver;
import io.github.yok.danp.core.linearalgebra.EjmlLuLinearSystemBackend;
import io.github.yok.danp.core.linearalgebra.LinearSystemBackend;
import io.github.yok.danp.in.CsvMatrixReader;
import io.github.yok.danp.out.CsvResultWriter;
import io.github.yok.danp.out.ResultWriter;
import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * DEMATEL + DANP 解析エンジン一式の Bean 定義を行う設定クラスです。
 */
@Configuration
@RequiredArgsConstructor
public class DematelDanpConfiguration {

    /**
     * danp-solver の設定値（danp.*）です。
     */
    private final DanpProperties p;

    /**
     * 連立方程式バックエンドを生成します。
     *
     * @return LU 分解による連立方程式バックエンドです
     */
    @Bean
    public LinearSystemBackend linearSystemBackend() {
        return new EjmlLuLinearSystemBackend();
    }

    /**
     * 総影響行列ソルバを生成します。
     *
     * @param backend 連立方程式バックエンドです
     * @return 総影響行列ソルバです
     */
    @Bean
    public TotalInfluenceSolver totalInfluenceSolver(LinearSystemBackend backend) {
        DanpProperties.Solver s = p.getSolver();
        return new TotalInfluenceSolver(backend, s.getSingularityTolerance(),
                s.getResidualTolerance());
    }

    /**
     * 超行列ビルダを生成します。
     *
     * @return 超行列ビルダです
     */
    @Bean
    public SupermatrixBuilder supermatrixBuilder() {
        DanpProperties.Supermatrix sm = p.getSupermatrix();
        return new SupermatrixBuilder(sm.getSelfBlockPolicy(), sm.getDimensionWeighting(),
                sm.isTransposeInfluence());
    }

    /**
     * 極限超行列ソルバを生成します。
     *
     * @return 極限超行列ソルバです
     */
    @Bean
    public LimitingSupermatrixSolver limitingSupermatrixSolver() {
        DanpProperties.Limit l = p.getLimit();
        return new LimitingSupermatrixSolver(l.getTolerance(), l.getMaxIterations(),
                l.getColumnTolerance());
    }

    /**
     * 解析エンジンを生成します。
     *
     * @param totalInfluenceSolver 総影響行列ソルバです
     * @param supermatrixBuilder 超行列ビルダです
     * @param limitingSupermatrixSolver 極限超行列ソルバです
     * @return 解析エンジンです
     */
    @Bean
    public DematelAnalysisEngine dematelAnalysisEngine(TotalInfluenceSolver totalInfluenceSolver,
            SupermatrixBuilder supermatrixBuilder,
            LimitingSupermatrixSolver limitingSupermatrixSolver) {
        return new DematelAnalysisEngine(new DirectInfluenceValidator(),
                new DirectInfluenceNormalizer(), totalInfluenceSolver,
                new ProminenceRelationCalculator(), new TotalInfluenceSimplifier(),
                supermatrixBuilder, limitingSupermatrixSolver, new WeightRanker());
    }

    /**
     * 直接影響行列の CSV 読み込みロジックを生成します。
     *
     * @return CSV 読み込みロジックです
     */
    @Bean
    public CsvMatrixReader csvMatrixReader() {
        return new CsvMatrixReader();
    }

    /**
     * 結果出力ロジックを生成します。
     *
     * @return 結果出力ロジックです
     */
    @Bean
    public ResultWriter resultWriter() {
        return new CsvResultWriter(p.getOutput().getDir());
    }
}
