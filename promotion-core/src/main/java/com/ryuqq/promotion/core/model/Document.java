package com.ryuqq.promotion.core.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RAG 문서.
 *
 * <p>임베딩은 벡터 인덱스의 {@code {collection}_{environment}} 컬렉션에
 * 문서 ID를 포인트 ID로 하여 저장됩니다.</p>
 *
 * @author Promotion Team
 * @since 1.0.0
 */
public final class Document extends PromotableItem implements HasVectorPoints {

    private final String title;
    private final String body;
    private final String collection;

    public Document(ItemId id, Environment environment, String title, String body, String collection) {
        super(id, environment);
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title cannot be null or blank");
        }
        if (collection == null || collection.isBlank()) {
            throw new IllegalArgumentException("collection cannot be null or blank");
        }
        this.title = title;
        this.body = body == null ? "" : body;
        this.collection = collection;
    }

    @Override
    public ContentKind kind() {
        return ContentKind.DOCUMENT;
    }

    @Override
    public String displayName() {
        return title;
    }

    @Override
    public Map<String, String> textFields() {
        Map<String, String> fields = new LinkedHashMap<>();
        fields.put("title", title);
        fields.put("body", body);
        return fields;
    }

    @Override
    protected PromotableItem copyContent(ItemId newId, Environment environment) {
        return new Document(newId, environment, title, body, collection);
    }

    @Override
    public String vectorCollection() {
        return collection;
    }

    public String getTitle() {
        return title;
    }

    public String getBody() {
        return body;
    }
}
