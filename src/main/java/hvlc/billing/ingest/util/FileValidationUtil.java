package hvlc.billing.ingest.util;

import org.springframework.web.multipart.MultipartFile;

import java.util.Arrays;
import java.util.Locale;

/**
 * Checks applied to uploaded report files before they are read.
 */
public class FileValidationUtil {

    private static final String DEFAULT_EXTENSION = ".csv";

    private FileValidationUtil() {
    }

    /**
     * @throws IllegalArgumentException if file is null or empty
     */
    public static void validateFileNotEmpty(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new IllegalArgumentException("File is empty or not provided");
        }
    }

    /**
     * @return the original filename
     * @throws IllegalArgumentException if filename is null or empty
     */
    public static String validateAndGetFilename(MultipartFile file) {
        String filename = file.getOriginalFilename();
        if (filename == null || filename.trim().isEmpty()) {
            throw new IllegalArgumentException("Invalid filename");
        }
        return filename;
    }

    /**
     * Validates that the file has one of the allowed extensions (case-insensitive).
     *
     * @param file the file to validate
     * @param allowedExtensions extensions without dot, e.g. "csv"
     * @throws IllegalArgumentException if file extension is not allowed
     */
    public static void validateFileExtension(MultipartFile file, String... allowedExtensions) {
        String filename = validateAndGetFilename(file);
        String lowerCaseFilename = filename.toLowerCase(Locale.ROOT);

        boolean isValid = Arrays.stream(allowedExtensions)
                .anyMatch(ext -> lowerCaseFilename.endsWith("." + ext.toLowerCase(Locale.ROOT)));

        if (!isValid) {
            String allowedTypes = Arrays.stream(allowedExtensions)
                    .map(ext -> ext.toUpperCase(Locale.ROOT))
                    .reduce((a, b) -> a + ", " + b)
                    .orElse("unknown");
            throw new IllegalArgumentException(
                    String.format("Invalid file type. Expected %s file but received '%s'. Please upload a valid report file.",
                            allowedTypes, filename));
        }
    }

    /**
     * Extension of a filename including the dot, lower-cased. Falls back to
     * ".csv" when the name has none, so temp copies of uploads keep a report suffix.
     */
    public static String extensionOf(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        int dot = name.lastIndexOf('.');
        if (dot <= 0 || dot == name.length() - 1) {
            return DEFAULT_EXTENSION;
        }
        return name.substring(dot).toLowerCase(Locale.ROOT);
    }

    /**
     * Non-empty and allowed extension.
     *
     * @throws IllegalArgumentException if validation fails
     */
    public static void validateFile(MultipartFile file, String... allowedExtensions) {
        validateFileNotEmpty(file);
        validateFileExtension(file, allowedExtensions);
    }
}
