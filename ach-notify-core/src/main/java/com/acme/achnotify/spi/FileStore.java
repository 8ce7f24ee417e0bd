package com.acme.achnotify.spi;

import com.acme.achnotify.domain.VoucherFile;

public interface FileStore {
  VoucherFile createFile(String name, byte[] contents, String folder);
}
