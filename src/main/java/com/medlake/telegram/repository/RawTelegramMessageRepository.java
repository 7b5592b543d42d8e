package com.medlake.telegram.repository;

import com.medlake.telegram.model.RawTelegramMessage;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface RawTelegramMessageRepository extends JpaRepository<RawTelegramMessage, Long> {
    /**
     * Counts loaded messages for a channel.
     */
    long countByChannelUsername(String channelUsername);
    /**
     * Returns (channel_username, message count) pairs ordered by channel.
     */
    @Query("select m.channelUsername, count(m) from RawTelegramMessage m group by m.channelUsername order by m.channelUsername")
    List<Object[]> countPerChannel();
}
