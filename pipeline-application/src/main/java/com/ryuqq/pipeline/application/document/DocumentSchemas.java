package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.chunking.Chunk;
import com.ryuqq.pipeline.core.chunking.ChunkingOptions;
import com.ryuqq.pipeline.core.schema.ObjectSchema;
import com.ryuqq.pipeline.core.schema.Schema;
import com.ryuqq.pipeline.core.schema.Schemas;

import java.time.Instant;
import java.util.List;

/**
 * 문서 처리 Workflow의 Step 경계 및 협력자 Schema.
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class DocumentSchemas {

    public static final ObjectSchema<DocumentSource> SOURCE = Schemas.object("document-source", DocumentSource.class)
        .field("type", DocumentSource::type, Schemas.enumOf("type", SourceType.class))
        .field("value", DocumentSource::value, Schemas.string("value").nonBlank())
        .build();

    public static final ObjectSchema<DocumentRequest> REQUEST = Schemas.object("document-request", DocumentRequest.class)
        .field("source", DocumentRequest::source, SOURCE)
        .field("chunking", DocumentRequest::chunking, Schemas.type("chunking", ChunkingOptions.class))
        .field("indexName", DocumentRequest::indexName, Schemas.string("indexName").nonBlank())
        .build();

    public static final ObjectSchema<LoadedDocument> LOADED = Schemas.object("loaded-document", LoadedDocument.class)
        .field("request", LoadedDocument::request, REQUEST)
        .field("content", LoadedDocument::content, Schemas.string("content"))
        .field("format", LoadedDocument::format, Schemas.enumOf("format", DocumentFormat.class))
        .optionalField("sourceUrl", LoadedDocument::sourceUrl, Schemas.string("sourceUrl").nonBlank())
        .field("wordCount", LoadedDocument::wordCount, Schemas.integer("wordCount").min(0))
        .build();

    public static final ObjectSchema<MarkdownDocument> MARKDOWN = Schemas.object("markdown-document", MarkdownDocument.class)
        .field("request", MarkdownDocument::request, REQUEST)
        .field("content", MarkdownDocument::content, Schemas.string("content"))
        .field("convertedFrom", MarkdownDocument::convertedFrom, Schemas.enumOf("convertedFrom", DocumentFormat.class))
        .optionalField("title", MarkdownDocument::title, Schemas.string("title").nonBlank())
        .optionalField("sourceUrl", MarkdownDocument::sourceUrl, Schemas.string("sourceUrl").nonBlank())
        .field("wordCount", MarkdownDocument::wordCount, Schemas.integer("wordCount").min(0))
        .optionalField("pageCount", MarkdownDocument::pageCount, Schemas.integer("pageCount").min(0))
        .build();

    public static final Schema<List<Chunk>> CHUNKS = Schemas.listOf("chunks", Schemas.type("chunk", Chunk.class));

    public static final ObjectSchema<ChunkedDocument> CHUNKED = Schemas.object("chunked-document", ChunkedDocument.class)
        .field("document", ChunkedDocument::document, MARKDOWN)
        .field("chunks", ChunkedDocument::chunks, CHUNKS)
        .field("averageChunkSize", ChunkedDocument::averageChunkSize, Schemas.integer("averageChunkSize").min(0))
        .build();

    public static final ObjectSchema<IndexMetadata> INDEX_METADATA = Schemas.object("index-metadata", IndexMetadata.class)
        .optionalField("title", IndexMetadata::title, Schemas.string("title"))
        .optionalField("sourceUrl", IndexMetadata::sourceUrl, Schemas.string("sourceUrl"))
        .field("processedAt", IndexMetadata::processedAt, Schemas.type("processedAt", Instant.class))
        .field("vectorIds", IndexMetadata::vectorIds, Schemas.listOf("vectorIds", Schemas.string("vectorId").nonBlank()))
        .build();

    public static final ObjectSchema<IndexedDocument> INDEXED = Schemas.object("indexed-document", IndexedDocument.class)
        .field("documentId", IndexedDocument::documentId, Schemas.string("documentId").nonBlank())
        .field("chunksCount", IndexedDocument::chunksCount, Schemas.integer("chunksCount").min(0))
        .field("indexName", IndexedDocument::indexName, Schemas.string("indexName").nonBlank())
        .field("summary", IndexedDocument::summary, Schemas.string("summary").nonBlank())
        .field("metadata", IndexedDocument::metadata, INDEX_METADATA)
        .rule("metadata.vectorIds", document -> document.metadata().vectorIds().size() == document.chunksCount(),
            "must hold one vector id per chunk")
        .build();

    // ========================================
    // Collaborators
    // ========================================

    public static final Schema<String> FETCH_URL = Schemas.string("url").nonBlank();

    public static final ObjectSchema<FetchedResource> FETCHED = Schemas.object("fetched-resource", FetchedResource.class)
        .field("body", FetchedResource::body, Schemas.string("body"))
        .field("contentType", FetchedResource::contentType, Schemas.string("contentType"))
        .build();

    public static final ObjectSchema<PdfConversion> PDF_CONVERSION = Schemas.object("pdf-conversion", PdfConversion.class)
        .field("markdown", PdfConversion::markdown, Schemas.string("markdown"))
        .optionalField("pageCount", PdfConversion::pageCount, Schemas.integer("pageCount").min(0))
        .build();

    public static final ObjectSchema<IndexRequest> INDEX_REQUEST = Schemas.object("index-request", IndexRequest.class)
        .field("documentId", IndexRequest::documentId, Schemas.string("documentId").nonBlank())
        .field("indexName", IndexRequest::indexName, Schemas.string("indexName").nonBlank())
        .field("chunks", IndexRequest::chunks, CHUNKS)
        .build();

    public static final ObjectSchema<IndexReceipt> INDEX_RECEIPT = Schemas.object("index-receipt", IndexReceipt.class)
        .field("vectorIds", IndexReceipt::vectorIds, Schemas.listOf("vectorIds", Schemas.string("vectorId").nonBlank()))
        .build();

    // Utility class - prevent instantiation
    private DocumentSchemas() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }
}
