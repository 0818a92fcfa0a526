package org.evalux.landlord.repo;

import org.evalux.landlord.model.Player;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlayerRepository extends JpaRepository<Player, Long> {
    boolean existsByNameIgnoreCase(String name);
    List<Player> findAllByOrderByNameAsc();
}
