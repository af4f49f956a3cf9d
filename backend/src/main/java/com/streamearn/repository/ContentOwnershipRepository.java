package com.streamearn.repository;

import com.streamearn.model.ContentOwnership;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContentOwnershipRepository extends JpaRepository<ContentOwnership, String> {
}
