package org.testplan.output;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.testplan.QuestionnaireFixtures;
import org.testplan.model.ComparisonOperator;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FormStructureIndexWriterTest {

    private final FormStructureIndexWriter writer = new FormStructureIndexWriter();

    @Test
    void write_shouldProduceGatingAndIndexFiles(@TempDir Path tempDir) throws IOException {
        // When
        List<Path> written = writer.write(QuestionnaireFixtures.serviceRequest(), tempDir);

        // Then
        assertThat(written).extracting(path -> path.getFileName().toString())
                .containsExactly("Service Request_gating_relationships.csv", "Service Request_question_index.csv");

        List<String> gating = Files.readAllLines(written.get(0), StandardCharsets.UTF_8);
        assertThat(gating.get(0)).startsWith("Questionnaire_Name,Parent_Question_Number");
        assertThat(gating).hasSize(1 + 6);
        assertThat(gating.get(1)).isEqualTo("Service Request,Q1,ServiceType,Yes,Q3,DetailsA,==,A");
        assertThat(gating).contains("Service Request,Q6,HiddenMode,No,Q8,NeverShown,==,A");

        List<String> index = Files.readAllLines(written.get(1), StandardCharsets.UTF_8);
        assertThat(index).hasSize(1 + 8);
        assertThat(index.get(1)).isEqualTo("Service Request,Q1,ServiceType,RadioButtons,TEST_VAR,0,,3,\"Q3, Q4, Q5\"");
        assertThat(index).contains("Service Request,Q7,BOnly,Text,DATA_COL,1,Q6,0,");
    }

    @Test
    void csvLine_shouldQuoteFieldsWithSeparatorsOrQuotes() {
        assertThat(FormStructureIndexWriter.csvLine(List.of("plain", "a,b", "say \"hi\"")))
                .isEqualTo("plain,\"a,b\",\"say \"\"hi\"\"\"\r\n");
    }

    @Test
    void displayOperator_shouldUseReadableSymbols() {
        assertThat(FormStructureIndexWriter.displayOperator(ComparisonOperator.NOT_EQUALS)).isEqualTo("!=");
        assertThat(FormStructureIndexWriter.displayOperator(ComparisonOperator.NOT_CONTAINS)).isEqualTo("does not contain");
    }
}
