package com.ryuqq.promotion.core.spi;

/**
 * 바이너리 오브젝트 스토리지 SPI.
 *
 * <p>환경 간 서버 측 복사는 가정하지 않습니다. 승격은 원본 버킷에서 읽은 바이트를
 * 대상 버킷에 쓰는 방식으로 수행됩니다.</p>
 *
 * <p>버킷명 규칙: {@code {environment}-{baseBucketName}} ({@link StoreNames#bucketName}).</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public interface ObjectStore {

    /**
     * 오브젝트 읽기.
     *
     * @param bucket 환경 접두사가 포함된 버킷명
     * @param key 오브젝트 키
     * @return 오브젝트 바이트
     * @throws StoreException 오브젝트가 없거나 읽기 실패
     */
    byte[] get(String bucket, String key);

    /**
     * 오브젝트 쓰기 (덮어쓰기).
     *
     * @param bucket 환경 접두사가 포함된 버킷명
     * @param key 오브젝트 키
     * @param data 오브젝트 바이트
     * @throws StoreException 쓰기 실패
     */
    void put(String bucket, String key, byte[] data);
}
