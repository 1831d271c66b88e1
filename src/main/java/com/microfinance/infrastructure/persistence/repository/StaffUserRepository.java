package com.microfinance.infrastructure.persistence.repository;

import com.microfinance.infrastructure.persistence.entity.StaffUserEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StaffUserRepository extends JpaRepository<StaffUserEntity, UUID> {

    Optional<StaffUserEntity> findByEmailIgnoreCase(String email);
}
