package com.vpnshop.fulfillment.api;

import lombok.Data;

@Data
public class RefundRequestDto {

    private String note;
}
