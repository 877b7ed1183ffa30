package com.stickerharvester.stickerbot.entity;

public class MissingIdentityException extends EntityParseException {
  public MissingIdentityException(EntityKind kind, String identityKey) {
    super(kind + " payload has no '" + identityKey + "'");
  }
}
