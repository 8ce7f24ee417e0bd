package com.acme.achnotify.spi;

import com.acme.achnotify.domain.MergedEmail;

public interface TemplateMergeService {
  MergedEmail mergeTemplate(String templateId, String authorId, String recipientId);
}
