package org.dxworks.omml2latex;

import org.approvaltests.Approvals;
import org.dxworks.omml2latex.converter.MathConverter;
import org.dxworks.omml2latex.model.EquationRecord;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class AppConvertFileApprovalTest {
    private static final String SAMPLES_BASE_PATH = "src/test/resources/samples/omml/";

    private static final MathConverter CONVERTER = new MathConverter(Omml2LatexConfig.defaults());

    @Test
    void convert_Calculus() {
        verify("calculus.xml");
    }

    @Test
    void convert_Structures() {
        verify("structures.xml");
    }

    @Test
    void convert_Degraded() {
        verify("degraded.xml");
    }

    private static void verify(String fileName) {
        Path filePath = Paths.get(SAMPLES_BASE_PATH + fileName);
        List<EquationRecord> records = App.convertFile(filePath, CONVERTER, true);
        Approvals.verify(TestUtils.render(records));
    }
}
