package org.dxworks.ommltex;

import org.approvaltests.Approvals;
import org.dxworks.ommltex.model.EquationConversion;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

public class OmmlSamplesApprovalTest {

    @Test
    void convert_Quadratic() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/quadratic.xml"));
    }

    @Test
    void convert_Matrix() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/matrix.xml"));
    }

    @Test
    void convert_Cases() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/cases.xml"));
    }

    @Test
    void convert_Integral() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/integral.xml"));
    }

    @Test
    void convert_Limit() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/limit.xml"));
    }

    @Test
    void convert_Decorations() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/decorations.xml"));
    }

    @Test
    void convert_Broken() throws Exception {
        verify(Paths.get("src/test/resources/samples/omml/broken.xml"));
    }

    @Test
    void convert_Quadratic_displayWrapping() throws Exception {
        OmmlTexConfig config = OmmlTexConfig.with(20000, MathWrapping.DISPLAY);
        EquationConversion conversion = App.convertFile(
                Paths.get("src/test/resources/samples/omml/quadratic.xml"),
                config);
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(conversion));
    }

    private static void verify(Path file) throws Exception {
        EquationConversion conversion = App.convertFile(file, OmmlTexConfig.defaults());
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(conversion));
    }
}
