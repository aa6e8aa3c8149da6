package com.productvideo.matching.embedding.db;

import com.productvideo.matching.shared.config.DatabaseConfig;
import com.productvideo.matching.shared.db.JdbcSupport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Optional;

public class EmbeddingRepository {
    private final DatabaseConfig config;

    public EmbeddingRepository(DatabaseConfig config) {
        this.config = Objects.requireNonNull(config, "config is null");
    }

    public Optional<String> findProductImagePath(String imageId) {
        return findPath("SELECT local_path FROM product_images WHERE img_id = ?", imageId, "product_images");
    }

    public Optional<String> findVideoFramePath(String frameId) {
        return findPath("SELECT local_path FROM video_frames WHERE frame_id = ?", frameId, "video_frames");
    }

    /** @return whether a row was updated */
    public boolean updateProductImageEmbedding(String imageId, float[] rgb, float[] gray) {
        return updateEmbedding(
                "UPDATE product_images SET emb_rgb = ?::vector, emb_gray = ?::vector WHERE img_id = ?",
                imageId, rgb, gray, "product_images");
    }

    /** @return whether a row was updated */
    public boolean updateVideoFrameEmbedding(String frameId, float[] rgb, float[] gray) {
        return updateEmbedding(
                "UPDATE video_frames SET emb_rgb = ?::vector, emb_gray = ?::vector WHERE frame_id = ?",
                frameId, rgb, gray, "video_frames");
    }

    private Optional<String> findPath(String sql, String id, String table) {
        try (Connection conn = JdbcSupport.open(config);
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.ofNullable(rs.getString("local_path"));
            }
        } catch (SQLException e) {
            throw JdbcSupport.wrap("Failed to query " + table, e);
        }
    }

    private boolean updateEmbedding(String sql, String id, float[] rgb, float[] gray, String table) {
        try (Connection conn = JdbcSupport.open(config);
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, JdbcSupport.vectorLiteral(rgb));
            ps.setString(2, JdbcSupport.vectorLiteral(gray));
            ps.setString(3, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw JdbcSupport.wrap("Failed to update " + table, e);
        }
    }
}
