package com.virtualsol.discovery.repository;

import com.virtualsol.discovery.entity.TokenWatch;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface TokenWatchRepository extends JpaRepository<TokenWatch, Long> {

    @Query("""
            select w from TokenWatch w
            where w.mint = :mint and (w.notifyOnGraduation = true or w.notifyOnMigration = true)
            """)
    List<TokenWatch> findNotifiableByMint(@Param("mint") String mint);

    /**
     * Rows of {@code [mint, count]}.
     */
    @Query("select w.mint, count(w) from TokenWatch w group by w.mint")
    List<Object[]> countByMint();
}
