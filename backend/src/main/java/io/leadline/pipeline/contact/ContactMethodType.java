package io.leadline.pipeline.contact;

public enum ContactMethodType {
  EMAIL,
  PHONE
}
