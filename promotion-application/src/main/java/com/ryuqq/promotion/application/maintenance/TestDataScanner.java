package com.ryuqq.promotion.application.maintenance;

import com.ryuqq.promotion.core.detection.TestDataDetector;
import com.ryuqq.promotion.core.model.ContentKind;
import com.ryuqq.promotion.core.model.Environment;
import com.ryuqq.promotion.core.model.PromotableItem;
import com.ryuqq.promotion.core.spi.ContentStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;

/**
 * 환경 내 테스트 데이터 스캔 및 표시 (유지보수 작업).
 *
 * <p>테스트 데이터로 표시된 항목은 isPromotable=false가 되어 승격 대상에서 제외됩니다.
 * 표시를 해제하지는 않습니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class TestDataScanner {

    private static final Logger log = LoggerFactory.getLogger(TestDataScanner.class);

    private final ContentStore contentStore;
    private final TestDataDetector detector;

    public TestDataScanner(ContentStore contentStore, TestDataDetector detector) {
        if (contentStore == null) {
            throw new IllegalArgumentException("contentStore cannot be null");
        }
        if (detector == null) {
            throw new IllegalArgumentException("detector cannot be null");
        }
        this.contentStore = contentStore;
        this.detector = detector;
    }

    /**
     * 스캔 실행.
     *
     * @param kind 콘텐츠 종류
     * @param environment 스캔할 환경
     * @param batchSize 이번 실행에서 검사할 최대 항목 수
     * @return 스캔 결과
     */
    public ScanReport scan(ContentKind kind, Environment environment, int batchSize) {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (environment == null) {
            throw new IllegalArgumentException("environment cannot be null");
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive (current: " + batchSize + ")");
        }

        List<PromotableItem> items = contentStore.findAll(kind, environment);
        int scanned = 0;
        int marked = 0;
        int alreadyMarked = 0;
        int errors = 0;

        for (PromotableItem item : items) {
            if (item.isTestData()) {
                alreadyMarked++;
                continue;
            }
            if (scanned >= batchSize) {
                continue;
            }
            scanned++;
            try {
                Optional<String> reason = detector.inspect(item);
                if (reason.isPresent()) {
                    item.markAsTestData(reason.get());
                    contentStore.update(item);
                    marked++;
                    log.info("Marked {} {} as test data: {}", kind.tag(), item.getId(), reason.get());
                }
            } catch (RuntimeException e) {
                errors++;
                log.warn("Test data check failed for {} {}: {}", kind.tag(), item.getId(), e.getMessage());
            }
        }

        log.info("Test data scan completed: {} in {}, scanned={}, marked={}, alreadyMarked={}, errors={}",
            kind.tag(), environment, scanned, marked, alreadyMarked, errors);
        return new ScanReport(kind, environment, scanned, marked, alreadyMarked, errors);
    }
}
