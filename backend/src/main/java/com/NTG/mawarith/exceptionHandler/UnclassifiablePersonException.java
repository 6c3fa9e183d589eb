package com.NTG.mawarith.exceptionHandler;

import com.NTG.mawarith.Entity.PersonId;
import lombok.Getter;

@Getter
public class UnclassifiablePersonException extends InheritanceException {

    private final PersonId personId;

    public UnclassifiablePersonException(PersonId personId, String message) {
        super(message);
        this.personId = personId;
    }
}
