package com.telcomax.assistant.memory;

public enum TurnRole {
  USER,
  SYSTEM
}
