package ru.tigran.assistantloganalytics.classifier;

import java.util.regex.Pattern;

/**
 * Question intents in classification priority order.
 * A question belongs to the first category whose pattern matches; {@link #OTHER} takes the rest.
 */
public enum IntentCategory {
    CHITCHAT("闲聊/问候",
            "你好|早上好|晚上好|谢谢|感谢|再见|hello|hi|哈哈|牛|厉害|智障|笨蛋|测试|谁|帮助"),
    PRICE("行情/价格",
            "价格|多少钱|报价|升贴水|价|结算|多少|钱|花费|行情"),
    TREND("趋势/预测",
            "走势|涨|跌|预测|后市|看法|分析|展望|趋势|动向"),
    DATA("数据/库存",
            "库存|仓单|产量|产能|进出口|表|数据|图|排产|开工率|销量|平衡表"),
    KNOWLEDGE("知识/百科",
            "是什么|定义|标准|工艺|介绍|牌号|区别|含义|科普"),
    OTHER("其他", null);

    private final String label;
    private final Pattern pattern;

    IntentCategory(String label, String regex) {
        this.label = label;
        this.pattern = regex == null ? null : Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public String getLabel() {
        return label;
    }

    boolean matches(String content) {
        return pattern != null && pattern.matcher(content).find();
    }
}
