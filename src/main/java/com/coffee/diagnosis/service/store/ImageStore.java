package com.coffee.diagnosis.service.store;

public interface ImageStore {

    String save(byte[] imageBytes);

    /**
     * @throws ImageNotFoundException when nothing is stored under the reference
     */
    byte[] read(String imageRef);
}
