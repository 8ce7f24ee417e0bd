package com.acme.achnotify.spi;

import com.acme.achnotify.domain.PrintTemplate;

public interface PrintTemplateStore {

  /**
   * @throws com.acme.achnotify.core.PermanentException when the template does not exist
   */
  PrintTemplate findPrintTemplate(String templateId);
}
