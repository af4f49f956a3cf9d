package com.streamearn.service;

import com.streamearn.model.ContentOwnership;
import com.streamearn.repository.ContentOwnershipRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaContentOwnershipLookup implements ContentOwnershipLookup {

    private final ContentOwnershipRepository contentOwnershipRepository;

    @Override
    @Transactional(readOnly = true)
    public Optional<String> findOwner(String contentId) {
        return contentOwnershipRepository.findById(contentId).map(ContentOwnership::getOwnerIdentity);
    }
}
