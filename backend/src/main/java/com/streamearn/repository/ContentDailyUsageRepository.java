package com.streamearn.repository;

import com.streamearn.model.ContentDailyUsage;
import com.streamearn.model.ContentDailyUsageId;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;

@Repository
public interface ContentDailyUsageRepository extends JpaRepository<ContentDailyUsage, ContentDailyUsageId> {

    List<ContentDailyUsage> findByIdentityAndUsageDate(String identity, LocalDate usageDate);

    @Query("select u.identity as identity, sum(u.secondsAccrued) as secondsAccrued " +
            "from ContentDailyUsage u where u.usageDate = :usageDate group by u.identity")
    List<IdentityUsageTotal> sumSecondsByIdentityOn(@Param("usageDate") LocalDate usageDate);

    @Modifying
    @Query("delete from ContentDailyUsage u where u.usageDate < :usageDate")
    int deleteOlderThan(@Param("usageDate") LocalDate usageDate);

    interface IdentityUsageTotal {
        String getIdentity();

        Long getSecondsAccrued();
    }
}
