package com.flamingo.imagelab.domain.repository;

import com.flamingo.imagelab.domain.entity.Image;
import java.util.UUID;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/** Repository for Image entities. */
@Repository
public interface ImageRepository extends JpaRepository<Image, UUID> {

  /** Finds an owner's images in the order given by the pageable's sort. */
  Page<Image> findByOwnerId(UUID ownerId, Pageable pageable);

  /** Counts images derived from a root. */
  long countByOriginalId(UUID originalId);

  /** Counts uploads, i.e. images that are the root of their chain. */
  long countByOriginalIdIsNull();
}
