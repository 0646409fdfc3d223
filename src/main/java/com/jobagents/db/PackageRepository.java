package com.jobagents.db;

import com.jobagents.client.PackageStore;
import com.jobagents.core.Result;
import com.jobagents.model.ApplicationPackage;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Repository for generated application packages.
 * All methods use PreparedStatement and try-with-resources for safe resource management.
 */
public class PackageRepository implements PackageStore {
    private static final Logger logger = Logger.getLogger(PackageRepository.class.getName());

    private final Database database;

    public PackageRepository(Database database) {
        this.database = database;
    }

    /**
     * Insert a package record. SQL errors are reported as a failed result.
     *
     * @param record the package; its id and createdAt are filled in on success
     * @return the generated id
     */
    @Override
    public Result<Long> persist(ApplicationPackage record) {
        try {
            return Result.ok(insert(record));
        } catch (SQLException e) {
            logger.log(Level.SEVERE, "Failed to persist package for job " + record.getJobId(), e);
            return Result.failure("Database error: " + e.getMessage(), e);
        }
    }

    /**
     * Insert a package record.
     *
     * @return the generated id
     * @throws SQLException if database operation fails
     */
    public long insert(ApplicationPackage record) throws SQLException {
        String sql = "INSERT INTO application_packages (job_id, title, company, score, resume_path, " +
                     "cover_letter_path, package_metadata, created_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";

        LocalDateTime now = LocalDateTime.now();
        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {

            stmt.setLong(1, record.getJobId());
            stmt.setString(2, record.getTitle());
            stmt.setString(3, record.getCompany());
            stmt.setDouble(4, record.getScore());
            stmt.setString(5, record.getResumePath());
            stmt.setString(6, record.getCoverLetterPath());
            stmt.setString(7, record.getMetadata());
            stmt.setTimestamp(8, Timestamp.valueOf(now));

            stmt.executeUpdate();

            try (ResultSet keys = stmt.getGeneratedKeys()) {
                if (!keys.next()) {
                    throw new SQLException("No id generated for package of job " + record.getJobId());
                }
                long id = keys.getLong(1);
                record.setId(id);
                record.setCreatedAt(now);
                logger.info("Stored package " + id + " for job " + record.getJobId());
                return id;
            }
        }
    }

    /**
     * @return every package stored for a posting, oldest first
     * @throws SQLException if database operation fails
     */
    public List<ApplicationPackage> findByJobId(long jobId) throws SQLException {
        String sql = "SELECT * FROM application_packages WHERE job_id = ? ORDER BY id";
        List<ApplicationPackage> packages = new ArrayList<>();

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {

            stmt.setLong(1, jobId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    packages.add(mapResultSetToPackage(rs));
                }
            }
        }
        return packages;
    }

    /**
     * @return total number of stored packages
     * @throws SQLException if database operation fails
     */
    public int countPackages() throws SQLException {
        String sql = "SELECT COUNT(*) FROM application_packages";

        try (Connection conn = database.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql);
             ResultSet rs = stmt.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        }
    }

    private ApplicationPackage mapResultSetToPackage(ResultSet rs) throws SQLException {
        ApplicationPackage pkg = new ApplicationPackage();
        pkg.setId(rs.getLong("id"));
        pkg.setJobId(rs.getLong("job_id"));
        pkg.setTitle(rs.getString("title"));
        pkg.setCompany(rs.getString("company"));
        pkg.setScore(rs.getDouble("score"));
        pkg.setResumePath(rs.getString("resume_path"));
        pkg.setCoverLetterPath(rs.getString("cover_letter_path"));
        pkg.setMetadata(rs.getString("package_metadata"));

        Timestamp createdAt = rs.getTimestamp("created_at");
        if (createdAt != null) {
            pkg.setCreatedAt(createdAt.toLocalDateTime());
        }
        return pkg;
    }
}
