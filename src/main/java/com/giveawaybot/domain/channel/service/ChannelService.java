package com.giveawaybot.domain.channel.service;

import com.giveawaybot.domain.channel.entity.Channel;
import com.giveawaybot.domain.channel.entity.ChannelSubscriber;
import com.giveawaybot.domain.channel.repository.ChannelRepository;
import com.giveawaybot.domain.channel.repository.ChannelSubscriberRepository;
import com.giveawaybot.domain.common.enums.AudienceType;
import com.giveawaybot.exception.BusinessException;
import com.giveawaybot.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Channels and their subscriber registry
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ChannelService {

    private final ChannelRepository channelRepository;
    private final ChannelSubscriberRepository subscriberRepository;
    private final Clock clock;

    public Channel getChannel(Long channelId) {
        return channelRepository.findByChannelId(channelId)
                .orElseThrow(() -> new ResourceNotFoundException("Channel", channelId));
    }

    public Optional<Channel> findChannel(Long channelId) {
        return channelRepository.findByChannelId(channelId);
    }

    public List<Channel> findAll() {
        return channelRepository.findAll();
    }

    @Transactional
    public Channel registerChannel(Long channelId, String channelName, String channelUsername,
                                   Long discussionGroupId, Long addedBy) {
        if (channelId == null || channelName == null || channelName.isBlank()) {
            throw new BusinessException("channel_id and channel_name are required");
        }
        if (channelRepository.findByChannelId(channelId).isPresent()) {
            throw new BusinessException("Channel " + channelId + " is already registered");
        }

        Channel channel = channelRepository.save(Channel.builder()
                .channelId(channelId)
                .channelName(channelName)
                .channelUsername(channelUsername)
                .discussionGroupId(discussionGroupId)
                .addedBy(addedBy)
                .build());

        log.info("Channel {} ({}) registered by {}", channelId, channelName, addedBy);
        return channel;
    }

    /**
     * Deletes the channel together with its subscriber registry
     */
    @Transactional
    public void removeChannel(Long channelId) {
        Channel channel = getChannel(channelId);
        int subscribers = subscriberRepository.deleteByChannelId(channelId);
        channelRepository.delete(channel);
        log.info("Channel {} removed with {} subscriber records", channelId, subscribers);
    }

    /**
     * Records a user joining the channel. A user who left earlier is re-subscribed.
     */
    @Transactional
    public void recordJoin(Long channelId, Long userId, String username, String firstName, String fullName) {
        LocalDateTime now = LocalDateTime.now(clock);
        ChannelSubscriber subscriber = subscriberRepository.findByChannelIdAndUserId(channelId, userId)
                .orElseGet(() -> ChannelSubscriber.builder()
                        .channelId(channelId)
                        .userId(userId)
                        .addedAt(now)
                        .build());

        subscriber.setUsername(username);
        subscriber.setFirstName(firstName);
        subscriber.setFullName(fullName);
        subscriber.setLeftAt(null);
        subscriberRepository.save(subscriber);
        log.info("Subscriber {} joined channel {}", userId, channelId);
    }

    /**
     * @return false when the user was not a known subscriber or had already left
     */
    @Transactional
    public boolean recordLeave(Long channelId, Long userId) {
        Optional<ChannelSubscriber> subscriber = subscriberRepository.findByChannelIdAndUserId(channelId, userId);
        if (subscriber.isEmpty() || !subscriber.get().isSubscribed()) {
            log.debug("Leave of unknown subscriber {} in channel {}", userId, channelId);
            return false;
        }
        subscriber.get().setLeftAt(LocalDateTime.now(clock));
        subscriberRepository.save(subscriber.get());
        log.info("Subscriber {} left channel {}", userId, channelId);
        return true;
    }

    /**
     * Marks activity of a user commenting in the channel's discussion group
     */
    @Transactional
    public boolean recordActivity(Long discussionGroupId, Long userId, String username,
                                  String firstName, String fullName) {
        Optional<Channel> channel = channelRepository.findByDiscussionGroupId(discussionGroupId);
        if (channel.isEmpty()) {
            log.debug("Group {} is not linked to a channel", discussionGroupId);
            return false;
        }

        Long channelId = channel.get().getChannelId();
        LocalDateTime now = LocalDateTime.now(clock);
        ChannelSubscriber subscriber = subscriberRepository.findByChannelIdAndUserId(channelId, userId)
                .orElseGet(() -> ChannelSubscriber.builder()
                        .channelId(channelId)
                        .userId(userId)
                        .addedAt(now)
                        .build());

        subscriber.setUsername(username);
        subscriber.setFirstName(firstName);
        subscriber.setFullName(fullName);
        subscriber.setLastActivityAt(now);
        subscriberRepository.save(subscriber);
        return true;
    }

    /**
     * User ids of a mailing audience
     */
    public List<Long> getAudience(Long channelId, AudienceType audienceType) {
        List<ChannelSubscriber> subscribers = audienceType.getActiveDays() > 0
                ? subscriberRepository.findActiveSince(channelId,
                        LocalDateTime.now(clock).minusDays(audienceType.getActiveDays()))
                : subscriberRepository.findByChannelIdAndLeftAtIsNull(channelId);

        return subscribers.stream()
                .map(ChannelSubscriber::getUserId)
                .toList();
    }

    public long countSubscribers(Long channelId) {
        return subscriberRepository.countByChannelIdAndLeftAtIsNull(channelId);
    }

    /**
     * Subscribers who had joined by the given moment and had not left by then
     */
    public long countSubscribersAsOf(Long channelId, LocalDateTime asOf) {
        return subscriberRepository.countSubscribedAsOf(channelId, asOf);
    }
}
