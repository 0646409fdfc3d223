package com.jobagents.db;

import com.jobagents.core.Result;
import com.jobagents.model.ApplicationPackage;
import com.jobagents.model.Candidate;
import com.jobagents.model.GenerationKind;
import org.json.JSONObject;
import org.junit.jupiter.api.*;

import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Repository tests against an in-memory H2 database.
 */
public class PackageRepositoryTest {

    private Database database;
    private PackageRepository repository;

    @BeforeEach
    public void setUp() throws SQLException {
        database = new Database("jdbc:h2:mem:packages_" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "", 2);
        database.initialize();
        repository = new PackageRepository(database);
    }

    @AfterEach
    public void tearDown() {
        database.close();
    }

    @Test
    public void testPersistAndFind() throws SQLException {
        Candidate candidate = new Candidate(42L, "Data Engineer", "Acme", "Pipelines");
        ApplicationPackage resume = ApplicationPackage.forDocument(GenerationKind.RESUME, candidate, 0.58,
                "generated/resumes/42_Acme_Data_Engineer.txt", "resume_agent");
        ApplicationPackage letter = ApplicationPackage.forDocument(GenerationKind.COVER_LETTER, candidate, 0.58,
                "generated/cover_letters/42_Acme_Data_Engineer.txt", "cover_letter_agent");

        Result<Long> first = repository.persist(resume);
        Result<Long> second = repository.persist(letter);

        assertTrue(first.isOk(), first.toString());
        assertTrue(second.get() > first.get(), "Ids should be generated in insertion order");
        assertEquals(first.get(), resume.getId());
        assertNotNull(resume.getCreatedAt());

        List<ApplicationPackage> stored = repository.findByJobId(42L);
        assertEquals(2, stored.size());
        assertEquals("generated/resumes/42_Acme_Data_Engineer.txt", stored.get(0).getResumePath());
        assertNull(stored.get(0).getCoverLetterPath());
        assertEquals(0.58, stored.get(1).getScore(), 1e-9);
        assertEquals("cover_letter_agent", new JSONObject(stored.get(1).getMetadata()).getString("agent"));

        assertEquals(2, repository.countPackages());
        assertTrue(repository.findByJobId(7L).isEmpty());
    }

    @Test
    public void testPersistFailureIsResult() {
        database.close();

        Result<Long> result = repository.persist(ApplicationPackage.forDocument(GenerationKind.RESUME,
                new Candidate(1L, "t", "c", "d"), 0.5, "p", "resume_agent"));

        assertTrue(result.isFailure());
        assertTrue(result.getError().startsWith("Database error"), result.getError());
    }

    @Test
    public void testClosingReturnsConnectionToPool() throws SQLException {
        // Pool of two: borrowing more than twice only works if close() hands connections back
        for (int i = 0; i < 5; i++) {
            Connection conn = database.getConnection();
            assertFalse(conn.isClosed());
            conn.close();
            assertTrue(conn.isClosed());
            conn.close();
        }
        assertEquals(0, repository.countPackages());
    }

    /**
     * A second close() on the same handle must not hand the physical connection back again.
     */
    @Test
    public void testDoubleCloseReturnsConnectionOnce() throws SQLException {
        Connection first = database.getConnection();
        Connection physical = first.unwrap(Connection.class);
        first.close();
        first.close();
        assertFalse(first.isValid(1), "A released handle is no longer usable");

        try (Connection a = database.getConnection(); Connection b = database.getConnection();
             Statement sa = a.createStatement(); Statement sb = b.createStatement()) {
            assertNotSame(a.unwrap(Connection.class), b.unwrap(Connection.class));
            assertTrue(a.unwrap(Connection.class) == physical || b.unwrap(Connection.class) == physical,
                    "The released connection is reused, not closed and replaced");
            assertTrue(sa.execute("SELECT 1"));
            assertTrue(sb.execute("SELECT 1"));
        }
        assertEquals(0, repository.countPackages());
    }
}
