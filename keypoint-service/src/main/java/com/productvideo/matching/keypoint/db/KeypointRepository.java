package com.productvideo.matching.keypoint.db;

import com.productvideo.matching.shared.config.DatabaseConfig;
import com.productvideo.matching.shared.db.JdbcSupport;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Objects;

/** Records keypoint blob locations on product image and video frame rows. */
public class KeypointRepository {
    private final DatabaseConfig config;

    public KeypointRepository(DatabaseConfig config) {
        this.config = Objects.requireNonNull(config, "config is null");
    }

    /** @return whether a row was updated */
    public boolean updateProductImageKeypoints(String imageId, String blobPath) {
        return update("UPDATE product_images SET kp_blob_path = ? WHERE img_id = ?", imageId, blobPath, "product_images");
    }

    /** @return whether a row was updated */
    public boolean updateVideoFrameKeypoints(String frameId, String blobPath) {
        return update("UPDATE video_frames SET kp_blob_path = ? WHERE frame_id = ?", frameId, blobPath, "video_frames");
    }

    private boolean update(String sql, String id, String blobPath, String table) {
        try (Connection conn = JdbcSupport.open(config);
             PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, blobPath);
            ps.setString(2, id);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw JdbcSupport.wrap("Failed to update keypoints in " + table, e);
        }
    }
}
