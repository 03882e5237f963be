package com.flamingo.imagelab.service.image;

import com.flamingo.imagelab.domain.entity.Image;
import java.util.List;

/** One page of an owner's images plus the owner's total image count. */
public record ImagePage(List<Image> images, long total, int limit, int offset) {}
