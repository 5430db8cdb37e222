package it.aw.dms.registry;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import it.aw.dms.model.CategoryResult;
import it.aw.dms.model.CategoryScore;
import it.aw.dms.model.DocumentContent;
import it.aw.dms.model.DocumentRecord;
import it.aw.dms.model.DocumentSummary;
import it.aw.dms.model.SearchFilter;
import it.aw.dms.model.TextChunk;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.sql.*;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registro dei documenti importati (metadata store), persistito in un file DuckDB.
 * <p>
 * Tabelle:
 * <ul>
 *   <li>{@code documents}: metadati di estrazione ed esito della categorizzazione
 *       (entità e alternative serializzate in JSON)</li>
 *   <li>{@code chunks}: testo dei chunk con pagina, directory e categoria, usato per i
 *       filtri e per la ricerca per keyword quando lo store vettoriale non risponde</li>
 * </ul>
 * Un'unica connessione JDBC è condivisa da tutte le operazioni; l'accesso
 * è sincronizzato (DuckDBConnection non è thread-safe).
 */
@Component
public class DocumentRegistry {

    private static final Logger log = LoggerFactory.getLogger(DocumentRegistry.class);

    private static final String CREATE_DOCUMENTS = """
            CREATE TABLE IF NOT EXISTS documents (
                document_id       VARCHAR   PRIMARY KEY,
                path              VARCHAR   NOT NULL UNIQUE,
                file_name         VARCHAR   NOT NULL,
                file_size         BIGINT    NOT NULL,
                page_count        INTEGER   NOT NULL,
                directory_label   VARCHAR   NOT NULL,
                imported_at       TIMESTAMP NOT NULL,
                extraction_method VARCHAR   NOT NULL,
                ocr_used          BOOLEAN   NOT NULL,
                processing_ms     BIGINT    NOT NULL,
                chunk_count       INTEGER   NOT NULL,
                category          VARCHAR,
                confidence        DOUBLE,
                entities          VARCHAR,
                suggested         VARCHAR
            )
            """;

    private static final String CREATE_CHUNKS = """
            CREATE TABLE IF NOT EXISTS chunks (
                chunk_id        VARCHAR   PRIMARY KEY,
                document_id     VARCHAR   NOT NULL,
                chunk_index     INTEGER   NOT NULL,
                page_number     INTEGER   NOT NULL,
                path            VARCHAR   NOT NULL,
                directory_label VARCHAR   NOT NULL,
                category        VARCHAR,
                imported_at     TIMESTAMP NOT NULL,
                content         VARCHAR   NOT NULL
            )
            """;

    private static final String SUMMARY_COLUMNS =
            "document_id, path, directory_label, imported_at, page_count, chunk_count, " +
            "extraction_method, category, confidence";

    private static final TypeReference<Map<String, String>> ENTITIES_TYPE = new TypeReference<>() {};
    private static final TypeReference<List<CategoryScore>> SCORES_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final String dbPath;
    private Connection conn;

    public DocumentRegistry(ObjectMapper objectMapper,
                            @Value("${dms.store.registry-path}") String dbPath) {
        this.objectMapper = objectMapper;
        this.dbPath = dbPath;
    }

    @PostConstruct
    void init() throws SQLException, IOException {
        Path path = Paths.get(dbPath);
        Files.createDirectories(path.toAbsolutePath().getParent());
        conn = DriverManager.getConnection("jdbc:duckdb:" + path.toAbsolutePath());
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(CREATE_DOCUMENTS);
            stmt.execute(CREATE_CHUNKS);
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_chunks_document ON chunks (document_id)");
        }
        log.info("DocumentRegistry: tabelle 'documents' e 'chunks' pronte su {}", path.toAbsolutePath());
    }

    @PreDestroy
    void close() {
        try {
            if (conn != null && !conn.isClosed()) conn.close();
        } catch (SQLException e) {
            log.warn("Errore chiusura connessione DuckDB registry: {}", e.getMessage());
        }
    }

    /**
     * Registra un documento con la sua categoria e i suoi chunk in un'unica transazione.
     */
    public synchronized DocumentRecord register(String documentId, DocumentContent content,
                                                CategoryResult category, List<TextChunk> chunks) {
        String fileName = Paths.get(content.path()).getFileName().toString();
        Timestamp importedAt = Timestamp.valueOf(content.importedAt());
        String categoryLabel = category != null ? category.primaryCategory() : null;
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO documents VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                ps.setString(1, documentId);
                ps.setString(2, content.path());
                ps.setString(3, fileName);
                ps.setLong(4, content.fileSize());
                ps.setInt(5, content.pageCount());
                ps.setString(6, content.directoryLabel());
                ps.setTimestamp(7, importedAt);
                ps.setString(8, content.method().label());
                ps.setBoolean(9, content.ocrUsed());
                ps.setLong(10, content.processingTime().toMillis());
                ps.setInt(11, chunks.size());
                ps.setString(12, categoryLabel);
                if (category != null) {
                    ps.setDouble(13, category.confidence());
                    ps.setString(14, objectMapper.writeValueAsString(category.entities()));
                    ps.setString(15, objectMapper.writeValueAsString(category.suggestedCategories()));
                } else {
                    ps.setNull(13, Types.DOUBLE);
                    ps.setNull(14, Types.VARCHAR);
                    ps.setNull(15, Types.VARCHAR);
                }
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO chunks VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)")) {
                for (TextChunk chunk : chunks) {
                    ps.setString(1, chunk.id());
                    ps.setString(2, documentId);
                    ps.setInt(3, chunk.chunkIndex());
                    ps.setInt(4, chunk.pageNumber());
                    ps.setString(5, content.path());
                    ps.setString(6, content.directoryLabel());
                    ps.setString(7, categoryLabel);
                    ps.setTimestamp(8, importedAt);
                    ps.setString(9, chunk.content());
                    ps.addBatch();
                }
                ps.executeBatch();
            }
            conn.commit();
        } catch (SQLException | JsonProcessingException e) {
            rollbackQuietly();
            throw new RuntimeException("Errore salvataggio documento nel registry: " + content.path(), e);
        } finally {
            restoreAutoCommit();
        }
        return findById(documentId)
                .orElseThrow(() -> new IllegalStateException("Documento appena registrato non trovato: " + documentId));
    }

    public synchronized Optional<DocumentRecord> findById(String documentId) {
        return findOne("SELECT * FROM documents WHERE document_id = ?", documentId);
    }

    public synchronized Optional<DocumentRecord> findByPath(String path) {
        return findOne("SELECT * FROM documents WHERE path = ?", path);
    }

    public synchronized List<DocumentSummary> findAll(SearchFilter filter) {
        FilterClause where = FilterClause.of(filter);
        List<DocumentSummary> result = new ArrayList<>();
        String sql = "SELECT " + SUMMARY_COLUMNS + " FROM documents" + where.sql() + " ORDER BY imported_at DESC, path";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            where.bind(ps, 1);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) result.add(toSummary(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura registry (summary)", e);
        }
        return result;
    }

    /**
     * Chunk candidati alla ricerca per keyword, già ristretti dal filtro.
     */
    public synchronized List<StoredChunk> keywordCandidates(SearchFilter filter) {
        FilterClause where = FilterClause.of(filter);
        List<StoredChunk> result = new ArrayList<>();
        String sql = "SELECT chunk_id, document_id, path, page_number, directory_label, content FROM chunks"
                + where.sql() + " ORDER BY path, chunk_index";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            where.bind(ps, 1);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(new StoredChunk(
                            rs.getString("chunk_id"),
                            rs.getString("document_id"),
                            rs.getString("path"),
                            rs.getInt("page_number"),
                            rs.getString("directory_label"),
                            rs.getString("content")));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura chunk dal registry", e);
        }
        return result;
    }

    /**
     * Rimuove il documento e i suoi chunk dal registry e restituisce i chunk IDs da cancellare
     * nell'embedding store. Ritorna {@link Optional#empty()} se il documento non esiste.
     */
    public synchronized Optional<List<String>> remove(String documentId) {
        List<String> chunkIds = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT COUNT(*) FROM documents WHERE document_id = ?")) {
            ps.setString(1, documentId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next() || rs.getInt(1) == 0) return Optional.empty();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Errore lettura documento dal registry", e);
        }
        try {
            conn.setAutoCommit(false);
            try (PreparedStatement ps = conn.prepareStatement(
                    "SELECT chunk_id FROM chunks WHERE document_id = ? ORDER BY chunk_index")) {
                ps.setString(1, documentId);
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) chunkIds.add(rs.getString(1));
                }
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM chunks WHERE document_id = ?")) {
                ps.setString(1, documentId);
                ps.executeUpdate();
            }
            try (PreparedStatement ps = conn.prepareStatement("DELETE FROM documents WHERE document_id = ?")) {
                ps.setString(1, documentId);
                ps.executeUpdate();
            }
            conn.commit();
        } catch (SQLException e) {
            rollbackQuietly();
            throw new RuntimeException("Errore rimozione documento dal registry", e);
        } finally {
            restoreAutoCommit();
        }
        return Optional.of(chunkIds);
    }

    /** Numero di documenti per categoria, dalla più frequente. */
    public synchronized Map<String, Integer> categorySummary() {
        return countBy("category");
    }

    /** Numero di documenti per directory label, dalla più frequente. */
    public synchronized Map<String, Integer> directorySummary() {
        return countBy("directory_label");
    }

    public synchronized int totalDocuments() {
        return count("SELECT COUNT(*) FROM documents");
    }

    public synchronized int totalChunks() {
        return count("SELECT COUNT(*) FROM chunks");
    }

    private Optional<DocumentRecord> findOne(String sql, String key) {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) return Optional.of(toRecord(rs));
            }
        } catch (SQLException | IOException e) {
            throw new RuntimeException("Errore lettura documento dal registry", e);
        }
        return Optional.empty();
    }

    private Map<String, Integer> countBy(String column) {
        Map<String, Integer> result = new LinkedHashMap<>();
        String sql = "SELECT COALESCE(" + column + ", '') AS k, COUNT(*) AS n FROM documents "
                + "GROUP BY k ORDER BY n DESC, k";
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            while (rs.next()) result.put(rs.getString("k"), rs.getInt("n"));
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio per " + column, e);
        }
        return result;
    }

    private int count(String sql) {
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery(sql)) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Errore conteggio: " + sql, e);
        }
    }

    private void rollbackQuietly() {
        try {
            conn.rollback();
        } catch (SQLException e) {
            log.warn("Rollback registry fallito: {}", e.getMessage());
        }
    }

    private void restoreAutoCommit() {
        try {
            conn.setAutoCommit(true);
        } catch (SQLException e) {
            log.warn("Ripristino autocommit fallito: {}", e.getMessage());
        }
    }

    private DocumentRecord toRecord(ResultSet rs) throws SQLException, IOException {
        String category = rs.getString("category");
        CategoryResult categoryResult = null;
        if (category != null) {
            String entities = rs.getString("entities");
            String suggested = rs.getString("suggested");
            categoryResult = new CategoryResult(
                    category,
                    rs.getDouble("confidence"),
                    entities != null ? objectMapper.readValue(entities, ENTITIES_TYPE) : Map.of(),
                    suggested != null ? objectMapper.readValue(suggested, SCORES_TYPE) : List.of());
        }
        return new DocumentRecord(
                rs.getString("document_id"),
                rs.getString("path"),
                rs.getString("file_name"),
                rs.getLong("file_size"),
                rs.getInt("page_count"),
                rs.getString("directory_label"),
                rs.getTimestamp("imported_at").toLocalDateTime(),
                rs.getString("extraction_method"),
                rs.getBoolean("ocr_used"),
                rs.getLong("processing_ms"),
                rs.getInt("chunk_count"),
                categoryResult);
    }

    private DocumentSummary toSummary(ResultSet rs) throws SQLException {
        return new DocumentSummary(
                rs.getString("document_id"),
                rs.getString("path"),
                rs.getString("directory_label"),
                rs.getTimestamp("imported_at").toLocalDateTime(),
                rs.getInt("page_count"),
                rs.getInt("chunk_count"),
                rs.getString("extraction_method"),
                rs.getString("category"),
                rs.getDouble("confidence"));
    }

    /**
     * Traduzione di un {@link SearchFilter} in clausola WHERE con parametri posizionali.
     * Vale per entrambe le tabelle, che hanno le stesse colonne di filtro.
     */
    private record FilterClause(String sql, List<Object> params) {

        static FilterClause of(SearchFilter filter) {
            if (filter == null || filter.isEmpty()) return new FilterClause("", List.of());
            List<String> conditions = new ArrayList<>();
            List<Object> params = new ArrayList<>();
            if (filter.category() != null) {
                conditions.add("category = ?");
                params.add(filter.category());
            }
            if (filter.directoryPrefix() != null) {
                conditions.add("(directory_label = ? OR directory_label LIKE ? ESCAPE '\\')");
                params.add(filter.directoryPrefix());
                params.add(escapeLike(filter.directoryPrefix()) + "/%");
            }
            if (filter.importedFrom() != null) {
                conditions.add("imported_at >= ?");
                params.add(Timestamp.valueOf(filter.importedFrom().atStartOfDay()));
            }
            if (filter.importedTo() != null) {
                LocalDate dayAfter = filter.importedTo().plusDays(1);
                conditions.add("imported_at < ?");
                params.add(Timestamp.valueOf(dayAfter.atStartOfDay()));
            }
            return new FilterClause(" WHERE " + String.join(" AND ", conditions), params);
        }

        void bind(PreparedStatement ps, int firstIndex) throws SQLException {
            int i = firstIndex;
            for (Object p : params) {
                if (p instanceof Timestamp ts) ps.setTimestamp(i++, ts);
                else ps.setString(i++, (String) p);
            }
        }

        private static String escapeLike(String s) {
            return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
        }
    }
}
