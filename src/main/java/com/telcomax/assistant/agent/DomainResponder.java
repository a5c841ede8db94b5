package com.telcomax.assistant.agent;

import com.telcomax.assistant.model.ResponderType;

public interface DomainResponder {

    ResponderType type();

    Draft draft(ResponderContext context);
}
