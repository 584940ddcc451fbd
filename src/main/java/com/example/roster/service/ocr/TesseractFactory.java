package com.example.roster.service.ocr;

import net.sourceforge.tess4j.ITesseract;
import net.sourceforge.tess4j.Tesseract;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.File;

/**
 * Creates configured Tesseract engines for the OCR token source.
 */
@Component
public class TesseractFactory {

    private static final Logger logger = LoggerFactory.getLogger(TesseractFactory.class);

    static final String JNA_LIBRARY_PATH = "jna.library.path";

    private static final String[] DEFAULT_TESSDATA_PATHS = {
        "/usr/share/tesseract-ocr/5/tessdata",
        "/usr/share/tesseract-ocr/4.00/tessdata",
        "/usr/share/tessdata",
        "/usr/local/share/tessdata",
        "/usr/local/share/tesseract-ocr/tessdata",
        "/opt/homebrew/share/tessdata",
        "C:/Program Files/Tesseract-OCR/tessdata",
        "./tessdata"
    };

    /**
     * @param tessdataPath        directory holding the trained data, auto-detected when blank
     * @param libraryPath         directory holding the native tesseract library, optional
     * @param language            tesseract language code, e.g. {@code eng}
     */
    public ITesseract create(String tessdataPath, String libraryPath, String language) {
        if (libraryPath != null && !libraryPath.isBlank()) {
            System.setProperty(JNA_LIBRARY_PATH, libraryPath);
            logger.debug("Native tesseract library path set to {}", libraryPath);
        }

        Tesseract tesseract = new Tesseract();
        // automatic page segmentation keeps word boxes for multi-column pages
        tesseract.setPageSegMode(3);
        tesseract.setOcrEngineMode(3);
        tesseract.setLanguage(language == null || language.isBlank() ? "eng" : language);

        String dataPath = resolveTessdataPath(tessdataPath);
        if (dataPath != null) {
            tesseract.setDatapath(dataPath);
            logger.debug("Tesseract data path: {}", dataPath);
        } else {
            logger.warn("Tesseract data path not found. Set --tessdata-path or TESSDATA_PREFIX if OCR fails");
        }
        return tesseract;
    }

    String resolveTessdataPath(String configured) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        String fromEnvironment = System.getenv("TESSDATA_PREFIX");
        if (isDirectory(fromEnvironment)) {
            return fromEnvironment;
        }
        for (String candidate : DEFAULT_TESSDATA_PATHS) {
            if (isDirectory(candidate)) {
                return candidate;
            }
        }
        return null;
    }

    private static boolean isDirectory(String path) {
        return path != null && !path.isBlank() && new File(path).isDirectory();
    }
}
