package me.go_gradually.liveavatar.domain.avatar;

public enum AvatarKind {
    STANDARD,
    PHOTO,
    CUSTOM
}
