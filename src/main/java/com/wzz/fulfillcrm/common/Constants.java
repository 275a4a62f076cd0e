package com.wzz.fulfillcrm.common;

import java.math.BigDecimal;

public final class Constants {

    private Constants() {}

    /** 金额保留位数 */
    public static final int MONEY_SCALE = 2;

    /** 数量保留位数 */
    public static final int QUANTITY_SCALE = 3;

    /** 订单号前缀 */
    public static final String ORDER_NUMBER_PREFIX = "ORD-";

    /** 默认币种 */
    public static final String DEFAULT_CURRENCY = "RUB";

    /** 默认付款方式 */
    public static final String DEFAULT_PAYMENT_METHOD = "BANK_TRANSFER";

    public static final BigDecimal HUNDRED = new BigDecimal("100");

    /** 供应商服务详情中返回的调价记录条数 */
    public static final int PRICE_HISTORY_LIMIT = 20;

    /** 科目详情中每个方向返回的最近分录条数 */
    public static final int ACCOUNT_RECENT_POSTINGS = 50;

    /** 仓库作业单号前缀 */
    public static final String TASK_NUMBER_PREFIX = "WT-";

    /** 库存移动列表默认返回条数 */
    public static final int MOVEMENT_LIST_LIMIT = 100;

    /** 商品、库位、作业详情中返回的最近移动条数 */
    public static final int MOVEMENT_RECENT_LIMIT = 50;

    /** 报损记账：借方 其他支出 */
    public static final String WRITE_OFF_DEBIT_ACCOUNT = "91.2";

    /** 报损记账：贷方 商品 */
    public static final String WRITE_OFF_CREDIT_ACCOUNT = "41";
}
