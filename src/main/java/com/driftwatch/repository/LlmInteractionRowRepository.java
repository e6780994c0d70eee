package com.driftwatch.repository;

import com.driftwatch.entity.LlmInteractionRow;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface LlmInteractionRowRepository extends JpaRepository<LlmInteractionRow, Long> {

    @Query("SELECT COALESCE(MAX(r.rowId), 0) FROM LlmInteractionRow r WHERE r.projectId = :projectId")
    long findMaxRowId(@Param("projectId") long projectId);

    List<LlmInteractionRow> findByProjectIdAndRowIdBetweenOrderByRowIdAsc(long projectId, long fromRow, long toRow);

    @Query("""
        SELECT AVG(r.responseTokenLength) FROM LlmInteractionRow r
        WHERE r.projectId = :projectId
          AND r.rowId BETWEEN :fromRow AND :toRow
    """)
    Double averageTokenLength(
        @Param("projectId") long projectId,
        @Param("fromRow") long fromRow,
        @Param("toRow") long toRow);

    @Modifying
    @Query("""
        UPDATE LlmInteractionRow r SET r.driftAffected = true
        WHERE r.projectId = :projectId
          AND r.rowId BETWEEN :fromRow AND :toRow
    """)
    int markDriftAffected(
        @Param("projectId") long projectId,
        @Param("fromRow") long fromRow,
        @Param("toRow") long toRow);
}
