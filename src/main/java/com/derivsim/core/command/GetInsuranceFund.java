package com.derivsim.core.command;

import com.fasterxml.jackson.annotation.JsonTypeName;

@JsonTypeName("get_insurance_fund")
public record GetInsuranceFund() implements Command {

    @Override
    public <R> R accept(CommandHandler<R> handler) {
        return handler.onGetInsuranceFund(this);
    }
}
