package com.ryuqq.pipeline.application.document;

import com.ryuqq.pipeline.core.capability.Generator;
import com.ryuqq.pipeline.core.chunking.Chunk;
import com.ryuqq.pipeline.core.chunking.ChunkingResult;
import com.ryuqq.pipeline.core.chunking.TextChunker;
import com.ryuqq.pipeline.core.composition.Branch;
import com.ryuqq.pipeline.core.context.ExecutionContext;
import com.ryuqq.pipeline.core.error.ContractViolationException;
import com.ryuqq.pipeline.core.step.Step;
import com.ryuqq.pipeline.core.step.Steps;
import com.ryuqq.pipeline.core.workflow.Workflow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * 문서 수집 Workflow (조건 분기 + 텍스트 분할).
 *
 * <p><strong>Stage 구성:</strong></p>
 * <pre>
 * load-document → by-format[convert-to-markdown | pass-text-through] → chunk-document → index-chunks
 * </pre>
 *
 * <p><strong>협력자:</strong></p>
 * <ul>
 *   <li>{@value #HTTP_FETCH} Tool: URL 본문 조회 (URL 출처에 필수)</li>
 *   <li>{@value #DOCUMENT_PROCESSOR} Generator: PDF → Markdown (없으면 안내 문서)</li>
 *   <li>{@value #VECTOR_INDEX} Tool: 청크 색인 (없으면 결정적 벡터 ID 부여)</li>
 * </ul>
 *
 * <p>load-document, convert-to-markdown은 2회까지 재시도합니다.</p>
 *
 * @author Pipeline Team
 * @since 1.0.0
 */
public final class DocumentProcessingWorkflow {

    private static final Logger log = LoggerFactory.getLogger(DocumentProcessingWorkflow.class);

    public static final String ID = "document-processing";

    public static final String LOAD_DOCUMENT = "load-document";
    public static final String BY_FORMAT = "by-format";
    public static final String CONVERT_TO_MARKDOWN = "convert-to-markdown";
    public static final String PASS_TEXT_THROUGH = "pass-text-through";
    public static final String CHUNK_DOCUMENT = "chunk-document";
    public static final String INDEX_CHUNKS = "index-chunks";

    public static final String HTTP_FETCH = "http-fetch";
    public static final String DOCUMENT_PROCESSOR = "document-processor";
    public static final String VECTOR_INDEX = "vector-index";

    static final int LOAD_RETRIES = 2;
    static final int CONVERT_RETRIES = 2;

    private static final TextChunker CHUNKER = new TextChunker();

    private DocumentProcessingWorkflow() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 시스템 시계와 UUID 기반 문서 ID로 Workflow 생성.
     *
     * @return 커밋된 Workflow
     */
    public static Workflow<DocumentRequest, IndexedDocument> create() {
        return create(Clock.systemUTC(), () -> "doc-" + UUID.randomUUID());
    }

    /**
     * Workflow 생성.
     *
     * @param clock processedAt 시각용 시계
     * @param documentIds 문서 ID 생성기
     * @return 커밋된 Workflow
     */
    public static Workflow<DocumentRequest, IndexedDocument> create(Clock clock, Supplier<String> documentIds) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (documentIds == null) {
            throw new IllegalArgumentException("documentIds cannot be null");
        }
        return Workflow.builder(ID, DocumentSchemas.REQUEST)
            .description("Document ingestion with format-dependent conversion")
            .then(loadDocument())
            .branch(byFormat())
            .then(chunkDocument())
            .then(indexChunks(clock, documentIds))
            .commit(DocumentSchemas.INDEXED);
    }

    // ========================================
    // Steps
    // ========================================

    static Step<DocumentRequest, LoadedDocument> loadDocument() {
        return Steps.define(LOAD_DOCUMENT)
            .description("Loads a document from a URL, a path or inline content")
            .retries(LOAD_RETRIES)
            .input(DocumentSchemas.REQUEST)
            .output(DocumentSchemas.LOADED)
            .handle((request, ctx) -> {
                DocumentSource source = request.source();
                ctx.progress(20, "Loading document from " + source.type().name().toLowerCase(Locale.ROOT));
                LoadedDocument loaded = switch (source.type()) {
                    case URL -> loadUrl(request, ctx);
                    case PATH -> loadPath(request);
                    case CONTENT -> loaded(request, source.value(), DocumentFormat.sniff(source.value()), null);
                };
                ctx.span().setAttribute("document.format", loaded.format().name());
                ctx.span().setAttribute("document.words", loaded.wordCount());
                ctx.progress(80, "Document loaded as " + loaded.format(), Map.of("format", loaded.format().name()));
                return loaded;
            });
    }

    static Branch<LoadedDocument, MarkdownDocument> byFormat() {
        return Branch.<LoadedDocument, MarkdownDocument>named(BY_FORMAT)
            .when("convertible", document -> document.format().requiresConversion(), convertToMarkdown())
            .when("textual", document -> !document.format().requiresConversion(), passTextThrough());
    }

    static Step<LoadedDocument, MarkdownDocument> convertToMarkdown() {
        return Steps.define(CONVERT_TO_MARKDOWN)
            .description("Converts PDF or HTML content to markdown")
            .retries(CONVERT_RETRIES)
            .input(DocumentSchemas.LOADED)
            .output(DocumentSchemas.MARKDOWN)
            .handle((document, ctx) -> {
                ctx.progress(30, "Converting " + document.format() + " to markdown");
                String markdown;
                Integer pageCount = null;
                if (document.format() == DocumentFormat.PDF) {
                    Optional<Generator> processor = ctx.generator(DOCUMENT_PROCESSOR);
                    if (processor.isPresent()) {
                        PdfConversion conversion = ctx.generate(processor.get(), pdfPrompt(document),
                            DocumentSchemas.PDF_CONVERSION).object();
                        markdown = conversion.markdown();
                        pageCount = conversion.pageCount();
                    } else {
                        log.warn("No '{}' generator registered, using placeholder for PDF {} (run={})",
                            DOCUMENT_PROCESSOR, document.content(), ctx.runId());
                        markdown = pdfPlaceholder(document.content());
                    }
                } else {
                    markdown = DocumentText.stripHtml(document.content());
                }
                ctx.progress(90, "Markdown conversion complete");
                return normalized(document, markdown, pageCount);
            });
    }

    static Step<LoadedDocument, MarkdownDocument> passTextThrough() {
        return Steps.define(PASS_TEXT_THROUGH)
            .description("Passes text and markdown through without conversion")
            .input(DocumentSchemas.LOADED)
            .output(DocumentSchemas.MARKDOWN)
            .handle((document, ctx) -> {
                ctx.progress(50, "Processing text content");
                return normalized(document, document.content(), null);
            });
    }

    static Step<MarkdownDocument, ChunkedDocument> chunkDocument() {
        return Steps.define(CHUNK_DOCUMENT)
            .description("Chunks the document with the requested strategy")
            .input(DocumentSchemas.MARKDOWN)
            .output(DocumentSchemas.CHUNKED)
            .handle((document, ctx) -> {
                ctx.progress(20, "Chunking with " + document.request().chunking().strategy() + " strategy");
                ChunkingResult result = CHUNKER.split(document.content(), document.request().chunking());
                ctx.span().setAttribute("chunk.count", result.totalChunks());
                ctx.span().setAttribute("chunk.averageSize", result.averageChunkSize());
                ctx.progress(90, "Created " + result.totalChunks() + " chunks",
                    Map.of("totalChunks", result.totalChunks(), "averageChunkSize", result.averageChunkSize()));
                return new ChunkedDocument(document, result.chunks(), result.averageChunkSize());
            });
    }

    static Step<ChunkedDocument, IndexedDocument> indexChunks(Clock clock, Supplier<String> documentIds) {
        return Steps.define(INDEX_CHUNKS)
            .description("Indexes the chunks")
            .input(DocumentSchemas.CHUNKED)
            .output(DocumentSchemas.INDEXED)
            .handle((chunked, ctx) -> {
                ctx.progress(20, "Indexing " + chunked.totalChunks() + " chunks");
                String documentId = documentIds.get();
                String indexName = chunked.document().request().indexName();
                List<String> vectorIds = index(documentId, indexName, chunked.chunks(), ctx);

                ctx.progress(90, "Generating summary");
                MarkdownDocument document = chunked.document();
                IndexMetadata metadata = new IndexMetadata(document.title(), document.sourceUrl(),
                    clock.instant(), vectorIds);
                log.info("Indexed document {} into '{}' with {} chunks (run={})",
                    documentId, indexName, chunked.totalChunks(), ctx.runId());
                return new IndexedDocument(documentId, chunked.totalChunks(), true, indexName,
                    DocumentText.summary(chunked.chunks()), metadata);
            });
    }

    // ========================================
    // Helpers
    // ========================================

    private static LoadedDocument loadUrl(DocumentRequest request, ExecutionContext ctx) throws Exception {
        String url = request.source().value();
        FetchedResource resource = ctx.invokeTool(HTTP_FETCH, url, FetchedResource.class);
        DocumentFormat format = DocumentFormat.fromContentType(resource.contentType());
        String content = format == DocumentFormat.PDF ? url : resource.body();
        return loaded(request, content, format, url);
    }

    private static LoadedDocument loadPath(DocumentRequest request) throws IOException {
        String path = request.source().value();
        DocumentFormat format = DocumentFormat.fromPath(path);
        String content = format == DocumentFormat.PDF
            ? path
            : Files.readString(Path.of(path), StandardCharsets.UTF_8);
        return loaded(request, content, format, null);
    }

    private static LoadedDocument loaded(DocumentRequest request, String content, DocumentFormat format, String sourceUrl) {
        return new LoadedDocument(request, content, format, sourceUrl, DocumentText.wordCount(content));
    }

    private static MarkdownDocument normalized(LoadedDocument document, String content, Integer pageCount) {
        return new MarkdownDocument(document.request(), content, document.format(), DocumentText.title(content),
            document.sourceUrl(), DocumentText.wordCount(content), pageCount);
    }

    private static List<String> index(String documentId, String indexName, List<Chunk> chunks,
                                      ExecutionContext ctx) throws Exception {
        if (ctx.tool(VECTOR_INDEX).isEmpty()) {
            List<String> vectorIds = new ArrayList<>(chunks.size());
            for (int i = 0; i < chunks.size(); i++) {
                vectorIds.add("vec-" + documentId + "-" + i);
            }
            return vectorIds;
        }
        IndexReceipt receipt = ctx.invokeTool(VECTOR_INDEX, new IndexRequest(documentId, indexName, chunks),
            IndexReceipt.class);
        if (receipt.vectorIds().size() != chunks.size()) {
            throw ContractViolationException.configuration(ctx.stepId(), "tool '" + VECTOR_INDEX + "' returned "
                + receipt.vectorIds().size() + " vector ids for " + chunks.size() + " chunks");
        }
        return receipt.vectorIds();
    }

    static String pdfPrompt(LoadedDocument document) {
        return "Convert the PDF at \"" + document.content() + "\" to markdown format. "
            + "Extract all text content while preserving structure.";
    }

    static String pdfPlaceholder(String location) {
        return "# Document\n\nPDF content from: " + location + "\n\n(PDF parsing requires " + DOCUMENT_PROCESSOR + ")";
    }
}
