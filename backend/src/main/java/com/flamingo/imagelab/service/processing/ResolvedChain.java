package com.flamingo.imagelab.service.processing;

import com.flamingo.imagelab.domain.entity.Image;

/**
 * An anchor image together with the root of its derivation chain.
 *
 * @param anchor the image the client referenced
 * @param root the upload at the start of the chain; the anchor itself when it is a root
 * @param depth parent links followed to get from anchor to root
 */
public record ResolvedChain(Image anchor, Image root, int depth) {}
