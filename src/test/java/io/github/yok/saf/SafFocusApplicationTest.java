package io.github.yok.saf;

import static org.junit.jupiter.api.Assertions.*;

import io.github.yok.saf.app.SafProperties;
import io.github.yok.saf.core.solver.FocusOptimizer;
import io.github.yok.saf.core.solver.StrehlScanner;
import io.github.yok.saf.out.CsvResultWriter;
import io.github.yok.saf.out.ResultWriter;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

/**
 * アプリケーション全体の配線と設定値のバインドを確認するテストです。
 */
@SpringBootTest(properties = {"saf.pupil.size=8", "saf.optics.numerical-aperture=1.2",
        "saf.stage.zspread-low=-800", "saf.depth-scan.values=0,2000", "saf.scan.threads=2",
        "saf.debug=false"})
class SafFocusApplicationTest {

    @Autowired
    private SafProperties properties;

    @Autowired
    private FocusOptimizer focusOptimizer;

    @Autowired
    private StrehlScanner strehlScanner;

    @Autowired
    private ResultWriter resultWriter;

    @Test
    void testContextLoads_PropertiesAreBound() {
        assertEquals(8, properties.getPupil().getSize());
        assertEquals(-800.0, properties.getStage().getZspreadLow());
        assertEquals(1000.0, properties.getStage().getZspreadHigh());
        assertEquals(1.51, properties.getOptics().getRefimmnom());
        assertEquals(List.of(0.0, 2000.0), properties.getDepthScan().getValues());
        assertFalse(properties.isDebug());
    }

    @Test
    void testContextLoads_BeansAreWired() {
        assertEquals(2, strehlScanner.getThreads());
        assertTrue(resultWriter instanceof CsvResultWriter);

        // 走査の刻みは 27 nm で、0 は格子上にありません
        FocusOptimizer.FocusResult r = focusOptimizer.optimize(properties.toOpticalParameters(0.0));
        assertEquals(150000.0, r.getStagePosition(), 27.0);
        assertTrue(r.getWrms() < 0.01 * 680.0);
    }
}
