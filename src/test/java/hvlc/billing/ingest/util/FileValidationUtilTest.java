package hvlc.billing.ingest.util;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockMultipartFile;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FileValidationUtilTest {

    @Test
    void testValidateFile_ValidCsv() {
        MockMultipartFile file = TestDataFactory.createCsvUpload("report.csv", "a,b\n1,2");

        assertThatCode(() -> FileValidationUtil.validateFile(file, "csv")).doesNotThrowAnyException();
    }

    @Test
    void testValidateFile_UppercaseExtension() {
        MockMultipartFile file = TestDataFactory.createCsvUpload("REPORT.CSV", "a,b\n1,2");

        assertThatCode(() -> FileValidationUtil.validateFile(file, "csv")).doesNotThrowAnyException();
    }

    @Test
    void testValidateFile_EmptyFile() {
        MockMultipartFile file = TestDataFactory.createCsvUpload("report.csv", "");

        assertThatThrownBy(() -> FileValidationUtil.validateFile(file, "csv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("File is empty or not provided");
    }

    @Test
    void testValidateFile_NullFile() {
        assertThatThrownBy(() -> FileValidationUtil.validateFile(null, "csv"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void testValidateFile_WrongExtension() {
        MockMultipartFile file = TestDataFactory.createCsvUpload("report.xlsx", "a,b\n1,2");

        assertThatThrownBy(() -> FileValidationUtil.validateFile(file, "csv"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Expected CSV file")
                .hasMessageContaining("report.xlsx");
    }

    @Test
    void testValidateAndGetFilename_Missing() {
        MockMultipartFile file = new MockMultipartFile("file", "", "text/csv", "a".getBytes());

        assertThatThrownBy(() -> FileValidationUtil.validateAndGetFilename(file))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Invalid filename");
    }

    @Test
    void testExtensionOf() {
        assertThat(FileValidationUtil.extensionOf("Settlement.CSV")).isEqualTo(".csv");
        assertThat(FileValidationUtil.extensionOf("exports/claims.tsv")).isEqualTo(".tsv");
        assertThat(FileValidationUtil.extensionOf("C:\\reports\\march.txt")).isEqualTo(".txt");
        assertThat(FileValidationUtil.extensionOf("README")).isEqualTo(".csv");
        assertThat(FileValidationUtil.extensionOf(".hidden")).isEqualTo(".csv");
        assertThat(FileValidationUtil.extensionOf(null)).isEqualTo(".csv");
    }
}
