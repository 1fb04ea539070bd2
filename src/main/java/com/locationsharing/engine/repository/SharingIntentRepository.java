package com.locationsharing.engine.repository;

import com.locationsharing.engine.entity.SharingIntent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SharingIntentRepository extends JpaRepository<SharingIntent, String> {
}
