package org.evalux.landlord.repo;

import org.evalux.landlord.model.MatchSummary;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface MatchSummaryRepository extends JpaRepository<MatchSummary, Long> {

    List<MatchSummary> findAllByOrderByStartedAtDesc(Pageable pageable);

    // matchs terminés d'un joueur, dans l'ordre de début (pour les séries)
    @Query("""
            select m from MatchSummary m
            where m.endedAt is not null
              and (m.playerAId = :playerId or m.playerBId = :playerId or m.playerCId = :playerId)
            order by m.startedAt asc, m.id asc
            """)
    List<MatchSummary> findFinishedForPlayerChronological(@Param("playerId") Long playerId);

    @Query("""
            select m from MatchSummary m
            where m.playerAId = :playerId or m.playerBId = :playerId or m.playerCId = :playerId
            order by m.startedAt desc
            """)
    List<MatchSummary> findForPlayerRecentFirst(@Param("playerId") Long playerId, Pageable pageable);

    @Query("""
            select m from MatchSummary m
            where m.endedAt is null
              and (m.playerAId in :playerIds or m.playerBId in :playerIds or m.playerCId in :playerIds)
            """)
    List<MatchSummary> findInProgressInvolving(@Param("playerIds") List<Long> playerIds);
}
