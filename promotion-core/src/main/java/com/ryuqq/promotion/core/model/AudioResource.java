package com.ryuqq.promotion.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 오디오 리소스.
 *
 * <p>바이너리 본문은 오브젝트 스토리지의 {@code {environment}-{bucket}/{objectKey}}에 저장됩니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class AudioResource extends PromotableItem implements HasPayload, HasSize {

    private final String filename;
    private final String contentType;
    private final long sizeBytes;
    private final PayloadLocation payloadLocation;

    public AudioResource(ItemId id, Environment environment, String filename, String contentType,
                         long sizeBytes, PayloadLocation payloadLocation) {
        super(id, environment);
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("filename cannot be null or blank");
        }
        if (sizeBytes < 0) {
            throw new IllegalArgumentException("sizeBytes cannot be negative (current: " + sizeBytes + ")");
        }
        if (payloadLocation == null) {
            throw new IllegalArgumentException("payloadLocation cannot be null");
        }
        this.filename = filename;
        this.contentType = contentType;
        this.sizeBytes = sizeBytes;
        this.payloadLocation = payloadLocation;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.AUDIO_RESOURCE;
    }

    @Override
    public String displayName() {
        return filename;
    }

    @Override
    public Map<String, String> textFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("filename", filename);
        fields.put("object_key", payloadLocation.objectKey());
        return fields;
    }

    @Override
    protected PromotableItem copyContent(ItemId newId, Environment environment) {
        return new AudioResource(newId, environment, filename, contentType, sizeBytes, payloadLocation);
    }

    @Override
    public PayloadLocation payloadLocation() {
        return payloadLocation;
    }

    @Override
    public long sizeBytes() {
        return sizeBytes;
    }

    public String getFilename() {
        return filename;
    }

    public String getContentTypeOrNull() {
        return contentType;
    }
}
