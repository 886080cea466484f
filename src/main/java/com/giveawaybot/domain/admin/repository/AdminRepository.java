package com.giveawaybot.domain.admin.repository;

import com.giveawaybot.domain.admin.entity.Admin;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface AdminRepository extends JpaRepository<Admin, Long> {

    Optional<Admin> findByUserId(Long userId);

    boolean existsByUserId(Long userId);

    List<Admin> findAllByOrderByCreatedAtAsc();
}
