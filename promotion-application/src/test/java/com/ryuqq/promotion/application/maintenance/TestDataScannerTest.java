package com.ryuqq.promotion.application.maintenance;

import com.ryuqq.promotion.core.detection.TestDataDetector;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Document;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.ItemId;
import com.ryuqq.promotion.core.spi.ContentStore;
import com.ryuqq.promotion.core.spi.StoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * TestDataScanner 유닛 테스트.
 *
 * @author Promotion Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TestDataScannerTest {

    @Mock
    private ContentStore contentStore;

    private TestDataScanner scanner;

    @BeforeEach
    void setUp() {
        scanner = new TestDataScanner(contentStore, new TestDataDetector());
    }

    private static Document doc(String id, String title) {
        Document doc = new Document(ItemId.of(id), Environment.DEV, title, "", "knowledge");
        doc.approveForPromotion();
        return doc;
    }

    @Test
    void 패턴에_맞는_항목을_테스트_데이터로_표시() {
        // given
        Document real = doc("d1", "Prayer times guide");
        Document fake = doc("d2", "Demo upload");
        Document marked = doc("d3", "anything");
        marked.markAsTestData("seeded");
        when(contentStore.findAll(ContentKind.DOCUMENT, Environment.DEV)).thenReturn(List.of(real, fake, marked));

        // when
        ScanReport report = scanner.scan(ContentKind.DOCUMENT, Environment.DEV, 100);

        // then
        assertThat(report.scanned()).isEqualTo(2);
        assertThat(report.markedAsTest()).isEqualTo(1);
        assertThat(report.alreadyMarked()).isEqualTo(1);
        assertThat(report.errors()).isZero();
        assertThat(fake.isTestData()).isTrue();
        assertThat(fake.isPromotable()).isFalse();
        assertThat(fake.getTestDataReasonOrNull()).isEqualTo("Field 'title': Matches test pattern: \\bdemo\\b");
        verify(contentStore).update(fake);
        verify(contentStore, never()).update(real);
    }

    @Test
    void 배치_크기만큼만_검사() {
        when(contentStore.findAll(ContentKind.DOCUMENT, Environment.DEV))
            .thenReturn(List.of(doc("d1", "test one"), doc("d2", "test two"), doc("d3", "test three")));

        ScanReport report = scanner.scan(ContentKind.DOCUMENT, Environment.DEV, 2);

        assertThat(report.scanned()).isEqualTo(2);
        assertThat(report.markedAsTest()).isEqualTo(2);
    }

    @Test
    void 저장_실패는_오류로_집계하고_계속() {
        Document first = doc("d1", "sample one");
        Document second = doc("d2", "sample two");
        when(contentStore.findAll(ContentKind.DOCUMENT, Environment.DEV)).thenReturn(List.of(first, second));
        doThrow(new StoreException("read only")).when(contentStore).update(first);

        ScanReport report = scanner.scan(ContentKind.DOCUMENT, Environment.DEV, 10);

        assertThat(report.errors()).isEqualTo(1);
        assertThat(report.markedAsTest()).isEqualTo(1);
        verify(contentStore).update(second);
    }
}
