package com.NTG.mawarith.rule;

import com.NTG.mawarith.DTOs.ShareClaim;
import com.NTG.mawarith.util.InheritanceCase;

import java.util.List;

public interface InheritanceRule {

    boolean canApply(InheritanceCase c);

    List<ShareClaim> calculate(InheritanceCase c);
}
