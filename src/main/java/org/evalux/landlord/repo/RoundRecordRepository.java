package org.evalux.landlord.repo;

import org.evalux.landlord.model.RoundRecord;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;
import java.util.Optional;

public interface RoundRecordRepository extends JpaRepository<RoundRecord, Long> {

    // manches d'un match, dans l'ordre de jeu
    List<RoundRecord> findByMatchIdOrderByGameIndexAsc(Long matchId);

    Optional<RoundRecord> findByMatchIdAndGameIndex(Long matchId, int gameIndex);

    // toutes les manches d'un joueur, quelle que soit sa place, plus ancienne d'abord
    @Query("""
            select r from RoundRecord r
            where r.playerAId = :playerId or r.playerBId = :playerId or r.playerCId = :playerId
            order by r.playedAt asc, r.matchId asc, r.gameIndex asc
            """)
    List<RoundRecord> findForPlayerChronological(@Param("playerId") Long playerId);

    boolean existsByPlayerAIdOrPlayerBIdOrPlayerCId(Long playerAId, Long playerBId, Long playerCId);

    @Modifying
    @Query("delete from RoundRecord r where r.matchId = :matchId")
    int deleteByMatchId(@Param("matchId") Long matchId);
}
