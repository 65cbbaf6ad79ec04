package com.example.acfeed;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ProductTypeDetectorTest {

    private final ProductTypeDetector detector = new ProductTypeDetector(List.of(
            "# comment",
            "vrv=Sistem VRV",
            "split=Aer conditionat split",
            "multisplit=Aer conditionat multisplit",
            "caseta=Aer conditionat caseta",
            "broken line"
    ));

    @Test
    void detect_longestKeywordWins() {
        assertThat(detector.detect("Unitate interioara VRV caseta Daikin FXZQ20A", List.of()))
                .isEqualTo("Aer conditionat caseta");
        assertThat(detector.detect("Unitate exterioara VRV Daikin RXYSQ4", List.of()))
                .isEqualTo("Sistem VRV");
    }

    @Test
    void detect_matchesWholeWordsIgnoringCaseAndDiacritics() {
        assertThat(detector.detect("Aer conditionat MULTISPLIT", List.of())).isEqualTo("Aer conditionat multisplit");
        assertThat(detector.detect("Unitate interioară casetă", List.of())).isEqualTo("Aer conditionat caseta");
    }

    @Test
    void detect_usesCategoryPath() {
        assertThat(detector.detect("Daikin FTXM25R", List.of("Rezidential", "Split"))).isEqualTo("Aer conditionat split");
    }

    @Test
    void detect_noMatch_isDefault() {
        assertThat(detector.detect("Telecomanda", List.of())).isEqualTo(ProductTypeDetector.DEFAULT_TYPE);
        assertThat(detector.detect(null, null)).isEqualTo(ProductTypeDetector.DEFAULT_TYPE);
    }

    @Test
    void load_readsBundledDictionary() {
        assertThat(ProductTypeDetector.load().detect("Aer conditionat tip consola Daikin", List.of()))
                .isEqualTo("Aer conditionat consola");
    }
}
