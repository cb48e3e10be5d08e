package com.bit.werewolf.structure.decision;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Value;

@Value
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ExecutedPlayer {
    int id;
    String name;
    //未公开角色时为null
    String role;
}
