package com.giveawaybot.domain.channel.repository;

import com.giveawaybot.domain.channel.entity.Channel;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ChannelRepository extends JpaRepository<Channel, Long> {

    Optional<Channel> findByChannelId(Long channelId);

    Optional<Channel> findByDiscussionGroupId(Long discussionGroupId);
}
